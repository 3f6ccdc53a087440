package edu.isi.hts;

/**
 * A node of a {@link DecisionTree}. Nodes live in the tree's node list and
 * point at each other by position in that list; NONE marks a missing link.
 * A non-leaf asks its question and goes to the yes child on a match.
 */
public class DecisionTreeNode {
	public static final int NONE = -1;

	private NodeType type;
	private String name;
	private String questionName;
	int index = NONE;
	int parent = NONE;
	int noChild = NONE;
	int yesChild = NONE;

	private DecisionTreeNode(NodeType type, String name, String questionName) {
		this.type = type;
		this.name = name;
		this.questionName = questionName;
	}

	public static DecisionTreeNode leaf(String name) {
		return new DecisionTreeNode(NodeType.LEAF, name, null);
	}

	public static DecisionTreeNode nonLeaf(String name, String questionName) {
		return new DecisionTreeNode(NodeType.NON_LEAF, name, questionName);
	}

	public NodeType getType() { return type; }
	public boolean isLeaf() { return type == NodeType.LEAF; }
	public String getName() { return name; }
	void setName(String n) { name = n; }
	public String getQuestionName() { return questionName; }

	/** position in the owning tree */
	public int getIndex() { return index; }
	public int getParent() { return parent; }
	public int getNoChild() { return noChild; }
	public int getYesChild() { return yesChild; }

	/** leaves are quoted when written out */
	public String getReference() {
		return isLeaf() ? "\""+name+"\"" : name;
	}

	public String toString() {
		if (isLeaf())
			return getReference();
		return name+" "+questionName+" "+noChild+" "+yesChild;
	}
}
