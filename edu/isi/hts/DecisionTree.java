package edu.isi.hts;

import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A binary decision tree in HTS text form:
 * <pre>
 * {*}[2].stream[1]
 * {
 *    0 C-Vowel      -1       "lsp_s2_1"
 *   -1 R-Nasal  "lsp_s2_2"  "lsp_s2_3"
 * }
 * </pre>
 * Non-leaves are named 0, -1, -2 ...; children are "no" then "yes".
 * A tree holding a single leaf is written as its name and the quoted leaf.
 * Nodes are kept in one list and refer to each other by position. Removal
 * leaves holes in the list until {@link #assignNameToNonLeafNode()} packs it.
 */
public class DecisionTree {
	private static final String START = "{";
	private static final String END = "}";
	private static Pattern spacePat = Pattern.compile("\\s+");

	private String name;
	private ArrayList<DecisionTreeNode> nodes = new ArrayList<DecisionTreeNode>();
	private int root = DecisionTreeNode.NONE;
	private TObjectIntHashMap<String> leafMap = new TObjectIntHashMap<String>(16, 0.5f, DecisionTreeNode.NONE);
	// parsed from the name on demand
	private int[] streamIndexes;

	public DecisionTree(String name) {
		this.name = name;
	}

	/** a tree holding one leaf */
	public DecisionTree(String name, String leafName) {
		this(name);
		root = add(DecisionTreeNode.leaf(leafName));
		leafMap.put(leafName, root);
	}

	/**
	 * Read a tree from its non-blank, trimmed lines: the name and one quoted
	 * leaf, or the name, "{", node lines and "}".
	 */
	public DecisionTree(List<String> lines) throws DataFormatException, UndefinedReferenceException {
		boolean debug = false;
		int n = lines.size();
		if (n == 0)
			throw new DataFormatException("Empty tree");
		if (!(n == 2 || (n >= 4 && lines.get(1).trim().equals(START) && lines.get(n-1).trim().equals(END))))
			throw new DataFormatException("Tree \""+lines.get(0)+"\" has invalid format");
		name = lines.get(0).trim();
		if (n == 2) {
			String leaf = unquote(lines.get(1).trim());
			root = add(DecisionTreeNode.leaf(leaf));
			leafMap.put(leaf, root);
			return;
		}
		// non-leaves first, so that children can point forward
		TObjectIntHashMap<String> nonLeaves = new TObjectIntHashMap<String>(n*2, 0.5f, DecisionTreeNode.NONE);
		List<String[]> fields = new ArrayList<String[]>();
		for (int i = 2; i < n-1; i++) {
			String[] f = spacePat.split(lines.get(i).trim());
			if (f.length != 4)
				throw new DataFormatException("Tree node should be \"name question no yes\" in tree "+name+": "+lines.get(i));
			if (nonLeaves.containsKey(f[0]))
				throw new DataFormatException("Node "+f[0]+" defined twice in tree "+name);
			nonLeaves.put(f[0], add(DecisionTreeNode.nonLeaf(f[0], f[1])));
			fields.add(f);
		}
		for (String[] f : fields) {
			int parent = nonLeaves.get(f[0]);
			DecisionTreeNode node = nodes.get(parent);
			node.noChild = resolve(f[2], parent, nonLeaves);
			node.yesChild = resolve(f[3], parent, nonLeaves);
		}
		root = 0;
		if (nodes.get(root).parent != DecisionTreeNode.NONE)
			throw new DataFormatException("First node of tree "+name+" is not its root");
		final int[] reached = new int[1];
		preOrderVisit(new NodeVisitor() {
				public boolean visit(DecisionTreeNode node) {
					reached[0]++;
					return true;
				}
			});
		if (reached[0] != nodes.size())
			throw new DataFormatException("Tree "+name+" has "+(nodes.size()-reached[0])+" nodes unreachable from its root");
		if (debug) Debug.debug(debug, "Read tree "+name+" with "+nodes.size()+" nodes");
	}

	// link a child reference of a node line, making a leaf if it is one
	private int resolve(String ref, int parent, TObjectIntHashMap<String> nonLeaves)
		throws DataFormatException, UndefinedReferenceException {
		int child;
		if (ref.startsWith("-")) {
			child = nonLeaves.get(ref);
			if (child == DecisionTreeNode.NONE)
				throw new UndefinedReferenceException("Tree "+name+" refers to undefined node "+ref);
			if (nodes.get(child).parent != DecisionTreeNode.NONE)
				throw new DataFormatException("Node "+ref+" has two parents in tree "+name);
		}
		else {
			String leaf = unquote(ref);
			if (leafMap.containsKey(leaf))
				throw new DataFormatException("Leaf "+leaf+" appears twice in tree "+name);
			child = add(DecisionTreeNode.leaf(leaf));
			leafMap.put(leaf, child);
		}
		nodes.get(child).parent = parent;
		return child;
	}

	private static String unquote(String s) {
		int b = 0, e = s.length();
		while (b < e && s.charAt(b) == '"')
			b++;
		while (e > b && s.charAt(e-1) == '"')
			e--;
		return s.substring(b, e);
	}

	private int add(DecisionTreeNode node) {
		node.index = nodes.size();
		nodes.add(node);
		return node.index;
	}

	/** attach a new non-leaf below parent (or as root when parent is NONE) and return it */
	public DecisionTreeNode addNonLeaf(int parent, boolean yes, String questionName) {
		DecisionTreeNode node = DecisionTreeNode.nonLeaf(null, questionName);
		attach(parent, yes, add(node));
		return node;
	}

	/** attach a new leaf below parent (or as root when parent is NONE) and return it */
	public DecisionTreeNode addLeaf(int parent, boolean yes, String leafName) {
		if (leafMap.containsKey(leafName))
			throw new IllegalArgumentException("Leaf "+leafName+" already in tree "+name);
		DecisionTreeNode node = DecisionTreeNode.leaf(leafName);
		int i = add(node);
		leafMap.put(leafName, i);
		attach(parent, yes, i);
		return node;
	}

	private void attach(int parent, boolean yes, int child) {
		if (parent == DecisionTreeNode.NONE) {
			if (root != DecisionTreeNode.NONE)
				throw new IllegalArgumentException("Tree "+name+" already has a root");
			root = child;
			return;
		}
		DecisionTreeNode p = nodes.get(parent);
		if (p.isLeaf())
			throw new IllegalArgumentException("Cannot attach a child to leaf "+p.getName());
		if (yes)
			p.yesChild = child;
		else
			p.noChild = child;
		nodes.get(child).parent = parent;
	}

	public String getName() { return name; }

	/** renaming drops the cached stream list */
	public void setName(String n) {
		name = n;
		streamIndexes = null;
	}

	public DecisionTreeNode getRoot() {
		return root == DecisionTreeNode.NONE ? null : nodes.get(root);
	}

	public DecisionTreeNode getNode(int i) {
		return nodes.get(i);
	}

	public DecisionTreeNode getNoChild(DecisionTreeNode node) {
		return node.noChild == DecisionTreeNode.NONE ? null : nodes.get(node.noChild);
	}

	public DecisionTreeNode getYesChild(DecisionTreeNode node) {
		return node.yesChild == DecisionTreeNode.NONE ? null : nodes.get(node.yesChild);
	}

	public DecisionTreeNode getParent(DecisionTreeNode node) {
		return node.parent == DecisionTreeNode.NONE ? null : nodes.get(node.parent);
	}

	/** live nodes in list order */
	public List<DecisionTreeNode> getNodes() {
		List<DecisionTreeNode> ret = new ArrayList<DecisionTreeNode>(nodes.size());
		for (DecisionTreeNode node : nodes)
			if (node != null)
				ret.add(node);
		return ret;
	}

	public int getNodeCount() {
		int count = 0;
		for (DecisionTreeNode node : nodes)
			if (node != null)
				count++;
		return count;
	}

	public DecisionTreeNode getLeaf(String leafName) {
		int i = leafMap.get(leafName);
		return i == DecisionTreeNode.NONE ? null : nodes.get(i);
	}

	public boolean hasLeaf(String leafName) {
		return leafMap.containsKey(leafName);
	}

	public List<DecisionTreeNode> getLeaves() {
		List<DecisionTreeNode> ret = new ArrayList<DecisionTreeNode>();
		for (DecisionTreeNode node : nodes)
			if (node != null && node.isLeaf())
				ret.add(node);
		return ret;
	}

	public List<DecisionTreeNode> getNonLeaves() {
		List<DecisionTreeNode> ret = new ArrayList<DecisionTreeNode>();
		for (DecisionTreeNode node : nodes)
			if (node != null && !node.isLeaf())
				ret.add(node);
		return ret;
	}

	/** visit from the root; false if the visitor stopped the walk */
	public boolean preOrderVisit(NodeVisitor visitor) {
		if (root == DecisionTreeNode.NONE)
			return true;
		return preOrderVisit(nodes.get(root), visitor);
	}

	public boolean preOrderVisit(DecisionTreeNode start, NodeVisitor visitor) {
		ArrayDeque<DecisionTreeNode> stack = new ArrayDeque<DecisionTreeNode>();
		stack.push(start);
		while (!stack.isEmpty()) {
			DecisionTreeNode node = stack.pop();
			if (!visitor.visit(node))
				return false;
			if (!node.isLeaf()) {
				// no child is visited first
				stack.push(nodes.get(node.yesChild));
				stack.push(nodes.get(node.noChild));
			}
		}
		return true;
	}

	/** nodes breadth first from the root */
	public List<DecisionTreeNode> getLayeredNodes() {
		List<DecisionTreeNode> ret = new ArrayList<DecisionTreeNode>();
		if (root == DecisionTreeNode.NONE)
			return ret;
		ArrayDeque<DecisionTreeNode> queue = new ArrayDeque<DecisionTreeNode>();
		queue.add(nodes.get(root));
		while (!queue.isEmpty()) {
			DecisionTreeNode node = queue.poll();
			ret.add(node);
			if (!node.isLeaf()) {
				queue.add(nodes.get(node.noChild));
				queue.add(nodes.get(node.yesChild));
			}
		}
		return ret;
	}

	/** every non-leaf has both children */
	public void validate() throws StructuralInvariantException {
		for (DecisionTreeNode node : nodes) {
			if (node == null)
				continue;
			if (node.isLeaf()) {
				if (node.noChild != DecisionTreeNode.NONE || node.yesChild != DecisionTreeNode.NONE)
					throw new StructuralInvariantException("Leaf "+node.getName()+" of tree "+name+" has children");
			}
			else if (node.noChild == DecisionTreeNode.NONE || node.yesChild == DecisionTreeNode.NONE) {
				throw new StructuralInvariantException("Node "+node.getName()+" of tree "+name+" lacks a child");
			}
		}
	}

	/**
	 * Walk down from the root asking each question of the label.
	 * @return the leaf reached
	 */
	public DecisionTreeNode filter(Map<String, Question> questions, Label label) throws UndefinedReferenceException {
		boolean debug = false;
		DecisionTreeNode node = getRoot();
		while (!node.isLeaf()) {
			Question q = questions.get(node.getQuestionName());
			if (q == null)
				throw new UndefinedReferenceException("Tree "+name+" asks undefined question "+node.getQuestionName());
			if (!label.hasFeature(q.getFeatureName()))
				throw new UndefinedReferenceException("Question "+q.getName()+" asks about feature "+
													  q.getFeatureName()+", which label "+label+" does not have");
			boolean yes = q.matches(label);
			if (debug) Debug.debug(debug, label+" "+(yes ? "matches " : "does not match ")+q.getName());
			node = nodes.get(yes ? node.yesChild : node.noChild);
		}
		return node;
	}

	/**
	 * Remove each named leaf together with its parent; the leaf's sibling takes
	 * the parent's place. Parents are taken as they were before the first
	 * removal, so a leaf whose parent already went away with its sibling stays.
	 * A tree that is a single leaf is left alone.
	 * @return number of leaves removed
	 */
	public int deleteLeaves(Collection<String> leafNames) {
		boolean debug = false;
		List<DecisionTreeNode> targets = new ArrayList<DecisionTreeNode>();
		TIntIntHashMap parentOf = new TIntIntHashMap();
		for (DecisionTreeNode node : nodes) {
			if (node != null && node.isLeaf() && leafNames.contains(node.getName())) {
				targets.add(node);
				parentOf.put(node.index, node.parent);
			}
		}
		int removed = 0;
		for (DecisionTreeNode leaf : targets) {
			int p = parentOf.get(leaf.index);
			if (p == DecisionTreeNode.NONE) {
				if (debug) Debug.debug(debug, "Keeping "+leaf.getName()+", the only node of "+name);
				continue;
			}
			if (nodes.get(p) == null) {
				Debug.warn("Keeping "+leaf.getName()+" in "+name+": its parent was removed with its sibling");
				continue;
			}
			DecisionTreeNode parent = nodes.get(p);
			int sibling = parent.noChild == leaf.index ? parent.yesChild : parent.noChild;
			int grand = parent.parent;
			if (grand == DecisionTreeNode.NONE) {
				root = sibling;
			}
			else {
				DecisionTreeNode g = nodes.get(grand);
				if (g.noChild == p)
					g.noChild = sibling;
				else
					g.yesChild = sibling;
			}
			nodes.get(sibling).parent = grand;
			nodes.set(leaf.index, null);
			nodes.set(p, null);
			leafMap.remove(leaf.getName());
			removed++;
			if (debug) Debug.debug(debug, "Removed "+leaf.getName()+" and "+parent.getName()+" from "+name);
		}
		assignNameToNonLeafNode();
		return removed;
	}

	/**
	 * Name non-leaves 0, -1, -2 ... in pre-order and pack the node list into
	 * that order, leaves last.
	 */
	public void assignNameToNonLeafNode() {
		if (root == DecisionTreeNode.NONE)
			return;
		final List<DecisionTreeNode> nonLeaves = new ArrayList<DecisionTreeNode>();
		final List<DecisionTreeNode> leaves = new ArrayList<DecisionTreeNode>();
		preOrderVisit(new NodeVisitor() {
				public boolean visit(DecisionTreeNode node) {
					if (node.isLeaf()) {
						leaves.add(node);
					}
					else {
						node.setName(Integer.toString(-nonLeaves.size()));
						nonLeaves.add(node);
					}
					return true;
				}
			});
		ArrayList<DecisionTreeNode> packed = new ArrayList<DecisionTreeNode>(nonLeaves.size()+leaves.size());
		packed.addAll(nonLeaves);
		packed.addAll(leaves);
		TIntIntHashMap remap = new TIntIntHashMap(packed.size()*2, 0.5f, DecisionTreeNode.NONE, DecisionTreeNode.NONE);
		for (int i = 0; i < packed.size(); i++)
			remap.put(packed.get(i).index, i);
		leafMap.clear();
		for (int i = 0; i < packed.size(); i++) {
			DecisionTreeNode node = packed.get(i);
			node.index = i;
			node.parent = remap.get(node.parent);
			node.noChild = remap.get(node.noChild);
			node.yesChild = remap.get(node.yesChild);
			if (node.isLeaf())
				leafMap.put(node.getName(), i);
		}
		nodes = packed;
		root = 0;
	}

	/** the streams this tree is for, from its name */
	public int[] getStreamIndexes() throws DataFormatException {
		if (streamIndexes == null)
			streamIndexes = DecisionTreeName.parseStreamIndexes(name);
		return streamIndexes.clone();
	}

	public boolean hasStream(int index) throws DataFormatException {
		for (int i : getStreamIndexes())
			if (i == index)
				return true;
		return false;
	}

	public int getStreamCount() throws DataFormatException {
		return getStreamIndexes().length;
	}

	public int getStateIndex() throws DataFormatException {
		return DecisionTreeName.parseStateIndex(name);
	}

	/** state index counted from the first emitting state */
	public int getEmittingStateIndex() throws DataFormatException {
		return getStateIndex() - DecisionForest.STATE_INDEX_BEGIN_OFFSET;
	}

	public String getPhone() {
		return DecisionTreeName.parsePhone(name);
	}

	/** true for trees of this phone and for phone-independent trees */
	public boolean matchPhone(String phone) {
		String mine = getPhone();
		return mine.equals(DecisionTreeName.ANY_PHONE) || mine.equals(phone);
	}

	/** model type shared by the leaves */
	public HmmModelType getModelType() {
		for (DecisionTreeNode leaf : getLeaves()) {
			HmmModelType t = HmmStreamName.parseModelType(leaf.getName());
			if (t != HmmModelType.INVALID)
				return t;
		}
		return HmmModelType.INVALID;
	}

	/**
	 * Drop one stream from the name.
	 * @throws IllegalArgumentException if the tree is not for that stream
	 * @throws StructuralInvariantException if it is the last stream
	 */
	public void pruneStream(int index) throws DataFormatException, StructuralInvariantException {
		int[] old = getStreamIndexes();
		if (!hasStream(index))
			throw new IllegalArgumentException("Stream "+index+" to prune is not in tree "+name);
		if (old.length == 1)
			throw new StructuralInvariantException("Cannot prune "+index+", the only stream of tree "+name);
		int[] kept = new int[old.length-1];
		int k = 0;
		for (int i : old)
			if (i != index)
				kept[k++] = i;
		setName(DecisionTreeName.replaceStreams(name, kept));
	}

	/** write in HTS layout; non-leaves in list order */
	public void save(Writer w) throws IOException {
		w.write(" "+name+"\n");
		if (getNodeCount() == 1) {
			w.write("   "+getRoot().getReference()+"\n");
			return;
		}
		w.write(START+"\n");
		for (DecisionTreeNode node : nodes) {
			if (node == null || node.isLeaf())
				continue;
			StringBuilder sb = new StringBuilder();
			sb.append(String.format(" %3s %-45s ", node.getName(), node.getQuestionName()));
			sb.append(childColumn(nodes.get(node.noChild)));
			sb.append(childColumn(nodes.get(node.yesChild)));
			w.write(sb.toString()+"\n");
		}
		w.write(END+"\n");
	}

	private static String childColumn(DecisionTreeNode child) {
		if (child.isLeaf())
			return String.format(" %15s ", child.getReference());
		return String.format("  %5s    ", child.getName());
	}

	/** names of every leaf, in list order */
	public List<String> getLeafNames() {
		List<String> ret = new ArrayList<String>();
		for (DecisionTreeNode leaf : getLeaves())
			ret.add(leaf.getName());
		return Collections.unmodifiableList(ret);
	}

	public boolean equals(Object o) {
		if (!(o instanceof DecisionTree))
			return false;
		return name.equals(((DecisionTree)o).name);
	}

	public int hashCode() {
		return name.hashCode();
	}

	public String toString() {
		return name;
	}
}
