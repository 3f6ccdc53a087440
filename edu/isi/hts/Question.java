package edu.isi.hts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A yes/no question about one feature of a label, in HTS notation:
 * <pre>QS L-Vowel { "*-a+*","*-e+*" }</pre>
 * The value set holds literal values, where '?' stands for any digit.
 * The expression text is cached; every setter drops the cache.
 */
public class Question {
	public static final String KEYWORD = "QS";

	private static Pattern questionPat = Pattern.compile("^\\s*QS\\s+(\"|')*([^\"']*)(\"|')*\\s+\\{(.*)\\}\\s*$");
	private static Pattern namePat = Pattern.compile("^(.*)(==|<=|<|>=|>)(.*)$");
	private static Pattern patternPat = Pattern.compile("\"*([^0-9a-zA-Z_?\"]*)([0-9a-zA-Z_?]+)([^0-9a-zA-Z_?\"]*)\"*");
	private static Pattern patternSplitPat = Pattern.compile("[, ]+");

	public static final char WILDCARD = '?';

	private String name;
	private String featureName;
	private QuestionOperator operator;
	private String valueSetName;
	private List<String> valueSet = new ArrayList<String>();
	private String leftSeparator = "";
	private String rightSeparator = "";
	private String expression;

	public Question() {
	}

	public Question(String featureName, QuestionOperator operator, String valueSetName, Collection<String> valueSet) {
		this.featureName = featureName;
		this.operator = operator;
		this.valueSetName = valueSetName;
		this.valueSet.addAll(valueSet);
	}

	/** read one QS line; '?' values are expanded into digits */
	public static Question parse(String line) throws DataFormatException {
		boolean debug = false;
		Matcher m = questionPat.matcher(line.trim());
		if (!m.matches() || m.group(2).length() == 0)
			throw new DataFormatException("Not a question: "+line);
		Question q = new Question();
		q.parseName(m.group(2));
		String[] patterns = patternSplitPat.split(m.group(4).trim());
		String left = null, right = null;
		for (String p : patterns) {
			if (p.length() == 0)
				continue;
			Matcher pm = patternPat.matcher(p);
			if (!pm.find())
				continue;
			String l = trimStars(pm.group(1));
			String r = trimStars(pm.group(3));
			if (left == null) {
				left = l;
				right = r;
			}
			else if (!left.equals(l) || !right.equals(r)) {
				Debug.warn("Question "+q.name+" mixes separators: "+p);
			}
			String value = pm.group(2);
			if (value.indexOf(WILDCARD) >= 0)
				q.valueSet.addAll(expandWildCard(value));
			else
				q.valueSet.add(value);
		}
		if (q.valueSet.isEmpty())
			throw new DataFormatException("Question has no values: "+line);
		q.leftSeparator = left;
		q.rightSeparator = right;
		if (debug) Debug.debug(debug, "Read "+q.name+" with "+q.valueSet.size()+" values");
		return q;
	}

	private static String trimStars(String s) {
		int b = 0, e = s.length();
		while (b < e && s.charAt(b) == '*')
			b++;
		while (e > b && s.charAt(e-1) == '*')
			e--;
		return s.substring(b, e);
	}

	// feature, operator and value set name out of a question name
	private void parseName(String n) throws DataFormatException {
		Matcher m = namePat.matcher(n);
		if (m.matches()) {
			featureName = m.group(1);
			operator = QuestionOperator.fromSymbol(m.group(2));
			valueSetName = m.group(3);
		}
		else {
			int dash = n.indexOf('-');
			int under = n.indexOf('_');
			int index = dash < 0 ? under : (under < 0 ? dash : Math.min(dash, under));
			if (index < 0)
				throw new DataFormatException("Unknown format of question name \""+n+"\"");
			featureName = n.substring(0, index);
			operator = QuestionOperator.BELONG;
			valueSetName = n.substring(index+1);
		}
		name = n;
	}

	/** every digit substitution of the '?' characters in value */
	public static List<String> expandWildCard(String value) {
		List<String> ret = new ArrayList<String>();
		ret.add(value);
		for (int i = 0; i < value.length(); i++) {
			if (value.charAt(i) != WILDCARD)
				continue;
			List<String> next = new ArrayList<String>(ret.size()*10);
			for (String v : ret)
				for (char d = '0'; d <= '9'; d++)
					next.add(v.substring(0, i)+d+v.substring(i+1));
			ret = next;
		}
		return ret;
	}

	/**
	 * true if value has the length of some pattern in the set and agrees
	 * with it everywhere the pattern is not a wildcard
	 */
	public static boolean matchPattern(Collection<String> valueSet, String value) {
		if (value == null)
			return false;
		for (String pattern : valueSet) {
			if (pattern.length() != value.length())
				continue;
			boolean ok = true;
			for (int i = 0; i < pattern.length() && ok; i++) {
				char c = pattern.charAt(i);
				if (c != WILDCARD && c != value.charAt(i))
					ok = false;
			}
			if (ok)
				return true;
		}
		return false;
	}

	public boolean matches(String value) {
		return matchPattern(valueSet, value);
	}

	/** ask this question of a label */
	public boolean matches(Label label) {
		return matches(label.getFeatureValue(featureName));
	}

	public String getName() {
		if (name == null) {
			if (featureName == null || featureName.length() == 0)
				throw new IllegalStateException("Question has no feature name");
			if (valueSetName == null || valueSetName.length() == 0)
				throw new IllegalStateException("Question on "+featureName+" has no value set name");
			name = featureName+operator.getSymbol()+valueSetName;
		}
		return name;
	}

	public String getFeatureName() { return featureName; }
	public void setFeatureName(String s) {
		featureName = s;
		resetName();
	}

	public QuestionOperator getOperator() { return operator; }
	public void setOperator(QuestionOperator op) {
		operator = op;
		resetName();
	}

	public String getValueSetName() { return valueSetName; }
	public void setValueSetName(String s) {
		valueSetName = s;
		resetName();
	}

	public List<String> getValueSet() {
		return Collections.unmodifiableList(valueSet);
	}
	public void setValueSet(Collection<String> values) {
		valueSet = new ArrayList<String>(values);
		expression = null;
	}

	public String getLeftSeparator() { return leftSeparator; }
	public String getRightSeparator() { return rightSeparator; }
	public void setSeparators(String left, String right) {
		leftSeparator = left == null ? "" : left;
		rightSeparator = right == null ? "" : right;
		expression = null;
	}

	private void resetName() {
		name = null;
		expression = null;
	}

	/** quoted, comma joined patterns; '*' only next to a separator */
	public String getPatterns() {
		if (valueSet.isEmpty())
			throw new IllegalStateException("Question "+getName()+" has an empty value set");
		String left = leftSeparator.length() == 0 ? "" : "*"+leftSeparator;
		String right = rightSeparator.length() == 0 ? "" : rightSeparator+"*";
		StringBuilder sb = new StringBuilder();
		for (String v : valueSet) {
			if (sb.length() > 0)
				sb.append(',');
			sb.append('"').append(left).append(v).append(right).append('"');
		}
		return sb.toString();
	}

	public String getExpression() {
		if (expression == null)
			expression = KEYWORD+" "+getName()+" { "+getPatterns()+" }";
		return expression;
	}

	public String toString() {
		return getExpression();
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Question))
			return false;
		return getExpression().equals(((Question)o).getExpression());
	}

	public int hashCode() {
		return getName().hashCode();
	}
}
