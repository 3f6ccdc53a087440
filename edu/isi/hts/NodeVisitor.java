package edu.isi.hts;

/** callback for tree walks; returning false stops the walk */
public interface NodeVisitor {
	public boolean visit(DecisionTreeNode node);
}
