package edu.isi.hts;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the questions for one feature. Each constructor fills in the
 * operator, value set name and value set; the feature name and separators
 * are supplied at the end by {@link #buildQuestions}.
 */
public class QuestionBuilder {

	/** how the values of an integer-coded feature may be compared */
	public enum ValueType { NULL, ENUMERABLE, INTEGER, PHONE_ID }

	private final List<Question> questions = new ArrayList<Question>();

	/**
	 * Belong questions over phone groups. Every phone of the inventory has to
	 * be in some group.
	 */
	public QuestionBuilder(List<PhoneQuestion> phoneQuestions, Collection<String> phones) throws CoverageException {
		for (PhoneQuestion pq : phoneQuestions) {
			if (pq.getPhones().isEmpty())
				throw new CoverageException("Phone question "+pq.getName()+" has no phones");
			pq.toHtk();
		}
		if (phoneQuestions.isEmpty())
			throw new CoverageException("No phone questions given");
		Set<String> unseen = new TreeSet<String>(phones);
		for (PhoneQuestion pq : phoneQuestions)
			unseen.removeAll(pq.getPhones());
		if (!unseen.isEmpty()) {
			StringBuilder sb = new StringBuilder();
			for (String p : unseen)
				sb.append(' ').append(p);
			throw new CoverageException("The phone questions do not cover phones:"+sb);
		}
		for (PhoneQuestion pq : phoneQuestions)
			add(QuestionOperator.BELONG, pq.getName(), pq.getPhones());
	}

	/** phone questions read from a file */
	public QuestionBuilder(BufferedReader phoneQuestionFile, Collection<String> phones)
		throws IOException, DataFormatException, CoverageException {
		this(PhoneQuestion.load(phoneQuestionFile), phones);
	}

	/** one Equal question per name, asking for its value */
	public QuestionBuilder(Map<String, ?> namedValues) {
		for (Map.Entry<String, ?> e : namedValues.entrySet())
			add(QuestionOperator.EQUAL, e.getKey(), Collections.singletonList(e.getValue().toString()));
	}

	/** one Equal question per constant, the value being its ordinal */
	public QuestionBuilder(Class<? extends Enum<?>> enumType) {
		for (Enum<?> e : enumType.getEnumConstants())
			add(QuestionOperator.EQUAL, e.name(), Collections.singletonList(Integer.toString(e.ordinal())));
	}

	/** Equal for every value, then LessEqual for every value but the smallest */
	public QuestionBuilder(Collection<Integer> values) {
		List<Integer> sorted = new ArrayList<Integer>(values);
		Collections.sort(sorted);
		for (Integer v : sorted)
			add(QuestionOperator.EQUAL, v.toString(), Collections.singletonList(v.toString()));
		for (int i = 1; i < sorted.size(); i++) {
			int v = sorted.get(i);
			add(QuestionOperator.LESS_EQUAL, Integer.toString(v), buildLessQuestionValueSetStartsWithDigit(v+1));
		}
	}

	/**
	 * Questions for a feature with a declared value type. Values outside
	 * [min, max] are skipped, a bound of 0 or less meaning unbounded.
	 * LessEqual value sets are spelled out value by value.
	 */
	public QuestionBuilder(Collection<Integer> values, int min, int max, ValueType type) {
		List<Integer> sorted = new ArrayList<Integer>(values);
		Collections.sort(sorted);
		if (type == ValueType.NULL || type == ValueType.ENUMERABLE) {
			for (Integer v : sorted) {
				if (outside(v, min, max))
					continue;
				add(QuestionOperator.EQUAL, v.toString(), Collections.singletonList(v.toString()));
			}
		}
		if (type == ValueType.NULL || type == ValueType.INTEGER) {
			for (Integer v : sorted) {
				if (outside(v, min, max))
					continue;
				List<String> set = new ArrayList<String>();
				for (int j = 0; j <= v; j++)
					set.add(Integer.toString(j));
				add(QuestionOperator.LESS_EQUAL, v.toString(), set);
			}
		}
	}

	private static boolean outside(int v, int min, int max) {
		return (min > 0 && v < min) || (max > 0 && v > max);
	}

	/** every integer in [min, max] */
	public QuestionBuilder(int min, int max) {
		this(range(min, max));
	}

	private static List<Integer> range(int min, int max) {
		List<Integer> ret = new ArrayList<Integer>();
		for (int i = min; i <= max; i++)
			ret.add(i);
		return ret;
	}

	public QuestionBuilder(QuestionOperator op, String valueSetName, List<String> valueSet) {
		add(op, valueSetName, valueSet);
	}

	/**
	 * A single question against an integer threshold. Greater and
	 * GreaterEqual are asked as LessEqual and Less; the answers swap, which
	 * a decision tree does not care about.
	 */
	public QuestionBuilder(QuestionOperator op, int value) {
		if (value < 0)
			throw new IllegalArgumentException("Question threshold "+value+" is negative");
		if (op == QuestionOperator.BELONG)
			op = QuestionOperator.EQUAL;
		else if (op == QuestionOperator.GREATER_EQUAL)
			op = QuestionOperator.LESS;
		else if (op == QuestionOperator.GREATER)
			op = QuestionOperator.LESS_EQUAL;
		String name = Integer.toString(value);
		switch (op) {
		case EQUAL:
			add(op, name, Collections.singletonList(name));
			break;
		case LESS:
			add(op, name, buildLessQuestionValueSetStartsWithDigit(value));
			break;
		case LESS_EQUAL:
			add(op, name, buildLessQuestionValueSetStartsWithDigit(value+1));
			break;
		default:
			throw new IllegalArgumentException("Unsupported question operator "+op);
		}
	}

	private void add(QuestionOperator op, String valueSetName, Collection<String> valueSet) {
		questions.add(new Question(null, op, valueSetName, valueSet));
	}

	public List<Question> getQuestions() {
		return Collections.unmodifiableList(questions);
	}

	/** attach the questions to a feature and return their expressions */
	public String[] buildQuestions(String featureName, String leftSeparator, String rightSeparator) {
		String[] ret = new String[questions.size()];
		for (int i = 0; i < ret.length; i++) {
			Question q = questions.get(i);
			q.setFeatureName(featureName);
			q.setSeparators(leftSeparator, rightSeparator);
			ret[i] = q.getExpression();
		}
		return ret;
	}

	/** attach the questions to slot i of a schema */
	public String[] buildQuestions(FeatureSchema schema, int i) {
		return buildQuestions(schema.getFeatureName(i), schema.getLeftSeparator(i), schema.getRightSeparator(i));
	}

	/** the question asking whether a feature does not apply */
	public static String buildNotApplicableFeatureQuestion(String featureName, String left, String right) {
		Question q = new Question(featureName, QuestionOperator.EQUAL, FeatureSchema.NOT_APPLICABLE,
								  Collections.singletonList(FeatureSchema.NOT_APPLICABLE));
		q.setSeparators(left, right);
		return q.getExpression();
	}

	/** values with every '?' replaced by each digit */
	public static List<String> extendQuestionMarkInValueSet(Collection<String> values) {
		List<String> ret = new ArrayList<String>();
		for (String v : values) {
			if (v.indexOf(Question.WILDCARD) < 0)
				ret.add(v);
			else
				ret.addAll(Question.expandWildCard(v));
		}
		return ret;
	}

	/**
	 * Patterns matching the decimal spelling of every integer in [0, value),
	 * none of them wildcards only.
	 */
	public static List<String> buildLessQuestionValueSetStartsWithDigit(int value) {
		List<String> ret = new ArrayList<String>();
		for (String s : buildLessQuestionValueSet(value)) {
			if (!allWildcards(s)) {
				ret.add(s);
				continue;
			}
			String rest = s.substring(1);
			// a lone '?' is any digit; longer numbers never start with 0
			for (int d = (s.length() == 1 ? 0 : 1); d <= 9; d++)
				ret.add(d+rest);
		}
		return ret;
	}

	private static boolean allWildcards(String s) {
		for (int i = 0; i < s.length(); i++)
			if (s.charAt(i) != Question.WILDCARD)
				return false;
		return true;
	}

	/**
	 * Patterns for [0, value) by decimal place: all shorter lengths as
	 * wildcards, the smaller leading digits followed by wildcards, then the
	 * leading digit followed by the zero-padded patterns of the remainder.
	 */
	public static List<String> buildLessQuestionValueSet(int value) {
		LinkedHashSet<String> ret = new LinkedHashSet<String>();
		if (value <= 9) {
			for (int i = 0; i < value; i++)
				ret.add(Integer.toString(i));
			return new ArrayList<String>(ret);
		}
		long times = 1;
		int digits = 0;
		while (times*10 <= value) {
			times *= 10;
			digits++;
		}
		int first = (int)(value/times);
		StringBuilder wild = new StringBuilder();
		for (int i = 0; i < digits; i++) {
			wild.append(Question.WILDCARD);
			ret.add(wild.toString());
		}
		for (int d = 1; d < first; d++)
			ret.add(d+wild.toString());
		for (String s : buildLessQuestionValueSet((int)(value - first*times))) {
			StringBuilder sb = new StringBuilder();
			sb.append(first);
			for (int i = s.length(); i < digits; i++)
				sb.append('0');
			sb.append(s);
			ret.add(sb.toString());
		}
		return new ArrayList<String>(ret);
	}
}
