package edu.isi.hts;

import gnu.trove.list.array.TIntArrayList;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The trees of one clustering run and the questions they ask. The file
 * starts with the QS lines, then holds the trees, each ended by a blank line.
 */
public class DecisionForest {
	/** HTK numbers emitting states from 2 */
	public static final int STATE_INDEX_BEGIN_OFFSET = 2;

	private final String name;
	private SortedMap<String, Question> questions = new TreeMap<String, Question>();
	private List<DecisionTree> trees = new ArrayList<DecisionTree>();
	private int[] streamIndexes;

	public DecisionForest(String name) {
		this.name = name;
	}

	public DecisionForest(String name, Collection<Question> questionList, List<DecisionTree> treeList) throws ConflictException {
		this(name);
		for (Question q : questionList)
			addQuestion(q);
		trees.addAll(treeList);
	}

	/**
	 * Read a forest. Leading lines with the QS keyword are questions; after
	 * them every blank-line delimited block is a tree.
	 */
	public DecisionForest(String name, BufferedReader br)
		throws IOException, DataFormatException, UndefinedReferenceException {
		this(name);
		boolean debug = false;
		Date startTime = new Date();
		boolean inQuestions = true;
		List<String> block = new ArrayList<String>();
		String line;
		int lineNum = 0;
		while ((line = br.readLine()) != null) {
			lineNum++;
			if (inQuestions) {
				if (line.indexOf(Question.KEYWORD) >= 0) {
					Question q = Question.parse(line);
					if (questions.containsKey(q.getName()))
						throw new DataFormatException("Question "+q.getName()+" defined twice, line "+lineNum);
					questions.put(q.getName(), q);
					continue;
				}
				if (line.trim().length() == 0)
					continue;
				inQuestions = false;
			}
			String trimmed = line.trim();
			if (trimmed.length() > 0) {
				block.add(trimmed);
			}
			else if (!block.isEmpty()) {
				trees.add(new DecisionTree(block));
				block = new ArrayList<String>();
			}
		}
		if (!block.isEmpty())
			throw new DataFormatException("Tree \""+block.get(0)+"\" in forest "+name+" is not ended by a blank line");
		if (debug) Debug.debug(debug, "Read "+questions.size()+" questions and "+trees.size()+" trees");
		Debug.dbtime(1, startTime, "Read forest "+name);
	}

	/**
	 * Union of the trees (by name; first one wins) and of the questions.
	 * @throws ConflictException when a question name has two expressions
	 */
	public static DecisionForest combine(String name, Collection<DecisionForest> forests) throws ConflictException {
		DecisionForest ret = new DecisionForest(name);
		LinkedHashSet<DecisionTree> union = new LinkedHashSet<DecisionTree>();
		for (DecisionForest f : forests) {
			union.addAll(f.trees);
			for (Question q : f.questions.values())
				ret.addQuestion(q);
		}
		ret.trees.addAll(union);
		return ret;
	}

	/** add a question; the same expression twice is fine */
	public void addQuestion(Question q) throws ConflictException {
		Question old = questions.get(q.getName());
		if (old == null)
			questions.put(q.getName(), q);
		else if (!old.getExpression().equals(q.getExpression()))
			throw new ConflictException("Question \""+q.getName()+"\" has two different expressions");
	}

	public void addTree(DecisionTree tree) {
		trees.add(tree);
		streamIndexes = null;
	}

	public String getName() { return name; }

	public SortedMap<String, Question> getQuestions() {
		return Collections.unmodifiableSortedMap(questions);
	}

	public List<DecisionTree> getTrees() {
		return Collections.unmodifiableList(trees);
	}

	public DecisionTree getTree(String treeName) {
		for (DecisionTree t : trees)
			if (t.getName().equals(treeName))
				return t;
		return null;
	}

	public List<DecisionTreeNode> getLeafNodes() {
		List<DecisionTreeNode> ret = new ArrayList<DecisionTreeNode>();
		for (DecisionTree t : trees)
			ret.addAll(t.getLeaves());
		return ret;
	}

	public List<DecisionTreeNode> getNonLeafNodes() {
		List<DecisionTreeNode> ret = new ArrayList<DecisionTreeNode>();
		for (DecisionTree t : trees)
			ret.addAll(t.getNonLeaves());
		return ret;
	}

	/** distinct phones of the trees, "*" for phone-independent ones */
	public List<String> getPhones() {
		LinkedHashSet<String> ret = new LinkedHashSet<String>();
		for (DecisionTree t : trees)
			ret.add(t.getPhone());
		return new ArrayList<String>(ret);
	}

	/** number of emitting states */
	public int getStateCount() throws DataFormatException {
		int max = STATE_INDEX_BEGIN_OFFSET-1;
		if (trees.isEmpty())
			return 0;
		for (DecisionTree t : trees)
			max = Math.max(max, t.getStateIndex());
		return max - STATE_INDEX_BEGIN_OFFSET + 1;
	}

	/** streams of the first tree */
	public int[] getStreamIndexes() throws DataFormatException {
		if (streamIndexes == null) {
			if (trees.isEmpty())
				return new int[0];
			streamIndexes = trees.get(0).getStreamIndexes();
		}
		return streamIndexes.clone();
	}

	public int getStreamCount() throws DataFormatException {
		return getStreamIndexes().length;
	}

	public HmmModelType getModelType() {
		for (DecisionTree t : trees) {
			HmmModelType type = t.getModelType();
			if (type != HmmModelType.INVALID)
				return type;
		}
		return HmmModelType.INVALID;
	}

	/** keep only questions that some non-leaf asks, sorted by name */
	public void reSortQuestions() throws UndefinedReferenceException {
		SortedMap<String, Question> used = new TreeMap<String, Question>();
		for (DecisionTreeNode node : getNonLeafNodes()) {
			String q = node.getQuestionName();
			if (used.containsKey(q))
				continue;
			Question question = questions.get(q);
			if (question == null)
				throw new UndefinedReferenceException("Question "+q+" is asked but not defined in forest "+name);
			used.put(q, question);
		}
		questions = used;
	}

	/** @return number of leaves removed over all trees */
	public int deleteLeaves(Collection<String> leafNames) {
		int removed = 0;
		for (DecisionTree t : trees)
			removed += t.deleteLeaves(leafNames);
		return removed;
	}

	/** drop streams from every tree that has them */
	public void pruneStream(int[] removing) throws DataFormatException, StructuralInvariantException {
		for (DecisionTree t : trees)
			for (int s : removing)
				if (t.hasStream(s))
					t.pruneStream(s);
		streamIndexes = null;
	}

	/** leaves reached by the label in every tree of its phone */
	public List<DecisionTreeNode> filter(Label label) throws UndefinedReferenceException {
		List<DecisionTreeNode> ret = new ArrayList<DecisionTreeNode>();
		String phone = label.getCentralPhone();
		for (DecisionTree t : trees)
			if (t.matchPhone(phone))
				ret.add(t.filter(questions, label));
		return ret;
	}

	/** the tree owning each leaf, in the order of {@link #filter} */
	public List<DecisionTree> matchingTrees(Label label) {
		List<DecisionTree> ret = new ArrayList<DecisionTree>();
		String phone = label.getCentralPhone();
		for (DecisionTree t : trees)
			if (t.matchPhone(phone))
				ret.add(t);
		return ret;
	}

	public void saveQuestions(Writer w) throws IOException {
		for (Question q : questions.values())
			w.write(q.getExpression()+"\n");
		w.write("\n");
	}

	public void saveTrees(Writer w) throws IOException {
		for (DecisionTree t : trees) {
			t.save(w);
			w.write("\n");
		}
	}

	public void save(Writer w) throws IOException {
		saveQuestions(w);
		saveTrees(w);
		w.flush();
	}

	/** number of trees per stream index, for summaries */
	public TIntArrayList getTreeCountsByStream() throws DataFormatException {
		TIntArrayList ret = new TIntArrayList();
		for (DecisionTree t : trees) {
			for (int s : t.getStreamIndexes()) {
				while (ret.size() <= s)
					ret.add(0);
				ret.set(s, ret.get(s)+1);
			}
		}
		return ret;
	}
}
