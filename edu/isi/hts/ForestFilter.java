package edu.isi.hts;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which triphones reach which leaves. Phones are pushed down a tree from
 * the root: at a question on the left, central or right phone the yes child
 * keeps the phones in the question and the no child the rest; any other
 * question lets the whole set through to both children.
 */
public class ForestFilter {

	/** leaf to triphones reaching it, for one tree; phone slots per the triphone schema */
	public static Map<DecisionTreeNode, TriphoneSet> getSelectiveTriphones(DecisionTree tree,
		Map<String, Question> questions, Collection<String> phones) throws UndefinedReferenceException {
		return getSelectiveTriphones(tree, questions, phones, FeatureSchema.TRIPHONE);
	}

	/**
	 * leaf to triphones reaching it, for one tree; slots 0 to 2 of schema name
	 * the phone features
	 */
	public static Map<DecisionTreeNode, TriphoneSet> getSelectiveTriphones(DecisionTree tree,
		Map<String, Question> questions, Collection<String> phones, FeatureSchema schema)
		throws UndefinedReferenceException {
		boolean debug = false;
		Map<DecisionTreeNode, TriphoneSet> ret = new LinkedHashMap<DecisionTreeNode, TriphoneSet>();
		TriphoneSet seed = new TriphoneSet(phones);
		String phone = tree.getPhone();
		if (!phone.equals(DecisionTreeName.ANY_PHONE)) {
			seed.getCentralPhones().clear();
			seed.getCentralPhones().add(phone);
		}
		ArrayDeque<DecisionTreeNode> queue = new ArrayDeque<DecisionTreeNode>();
		ArrayDeque<TriphoneSet> sets = new ArrayDeque<TriphoneSet>();
		queue.add(tree.getRoot());
		sets.add(seed);
		while (!queue.isEmpty()) {
			DecisionTreeNode node = queue.poll();
			TriphoneSet set = sets.poll();
			if (node.isLeaf()) {
				ret.put(node, set);
				continue;
			}
			Question q = questions.get(node.getQuestionName());
			if (q == null)
				throw new UndefinedReferenceException("Tree "+tree.getName()+" asks undefined question "+node.getQuestionName());
			TriphoneSet yes = new TriphoneSet(set);
			TriphoneSet no = set;
			int slot = phoneSlot(schema, q.getFeatureName());
			if (slot >= 0) {
				Set<String> values = new HashSet<String>(q.getValueSet());
				yes.getPhones(slot).retainAll(values);
				no.getPhones(slot).removeAll(values);
			}
			if (debug) Debug.debug(debug, node.getName()+" "+q.getName()+": no="+no+" yes="+yes);
			queue.add(tree.getNoChild(node));
			sets.add(no);
			queue.add(tree.getYesChild(node));
			sets.add(yes);
		}
		return ret;
	}

	// 0, 1, 2 for the phone slots, -1 otherwise
	private static int phoneSlot(FeatureSchema schema, String feature) {
		int n = Math.min(3, schema.size());
		for (int i = 0; i < n; i++)
			if (schema.getFeatureName(i).equals(feature))
				return i;
		return -1;
	}

	/**
	 * leaf name to triphones reaching it, over every tree of the forest
	 * @throws ConflictException if two trees share a leaf name
	 */
	public static Map<String, TriphoneSet> getSelectiveTriphones(DecisionForest forest, Collection<String> phones,
		FeatureSchema schema) throws UndefinedReferenceException, ConflictException {
		Map<String, TriphoneSet> ret = new LinkedHashMap<String, TriphoneSet>();
		for (DecisionTree tree : forest.getTrees()) {
			Map<DecisionTreeNode, TriphoneSet> sets = getSelectiveTriphones(tree, forest.getQuestions(), phones, schema);
			for (Map.Entry<DecisionTreeNode, TriphoneSet> e : sets.entrySet()) {
				if (ret.containsKey(e.getKey().getName()))
					throw new ConflictException("Leaf "+e.getKey().getName()+" is in more than one tree of "+forest.getName());
				ret.put(e.getKey().getName(), e.getValue());
			}
		}
		return ret;
	}

	/**
	 * For a forest clustered by phone model: the leaf each triphone goes to,
	 * found by running the labels it occurs in through the forest.
	 * @throws DataFormatException if a label reaches other than one leaf
	 */
	public static Map<Label, DecisionTreeNode> getPreselectionTriphones(DecisionForest forest, List<Label> labels)
		throws DataFormatException, UndefinedReferenceException {
		Map<Label, DecisionTreeNode> ret = new LinkedHashMap<Label, DecisionTreeNode>();
		for (Label label : labels) {
			Label triphone = toTriphone(label);
			if (ret.containsKey(triphone))
				continue;
			List<DecisionTreeNode> leaves = forest.filter(label);
			if (leaves.size() != 1)
				throw new DataFormatException("Label "+label+" reaches "+leaves.size()+
											  " leaves; not a pre-selection forest");
			ret.put(triphone, leaves.get(0));
		}
		return ret;
	}

	/** the left, central and right phone of a label */
	public static Label toTriphone(Label label) {
		Label ret = new Label(FeatureSchema.TRIPHONE);
		if (label.getLeftPhone() != null)
			ret.setValue(0, label.getLeftPhone());
		ret.setValue(1, label.getCentralPhone());
		if (label.getRightPhone() != null)
			ret.setValue(2, label.getRightPhone());
		return ret;
	}
}
