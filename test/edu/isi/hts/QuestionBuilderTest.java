package edu.isi.hts;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class QuestionBuilderTest {

	private enum Stress { NONE, PRIMARY, SECONDARY }

	private static Question find(List<Question> questions, String name) {
		for (Question q : questions)
			if (q.getName().equals(name))
				return q;
		throw new AssertionError("no question "+name);
	}

	@Test
	public void lessEqualOverIdentities() {
		QuestionBuilder b = new QuestionBuilder(Arrays.asList(0, 1, 2), 0, 0, QuestionBuilder.ValueType.INTEGER);
		b.buildQuestions(FeatureSchema.CENTRAL_PHONE, "-", "+");
		Question q = find(b.getQuestions(), "Phone.PhoneIdentity<=2");
		assertThat(q.getOperator()).isEqualTo(QuestionOperator.LESS_EQUAL);
		assertThat(q.getValueSet()).containsExactly("0", "1", "2");
	}

	@Test
	public void thresholdLessEqual() {
		QuestionBuilder b = new QuestionBuilder(QuestionOperator.LESS_EQUAL, 2);
		String[] expressions = b.buildQuestions(FeatureSchema.CENTRAL_PHONE, "-", "+");
		assertThat(expressions).hasLength(1);
		Question q = b.getQuestions().get(0);
		assertThat(q.getName()).isEqualTo("Phone.PhoneIdentity<=2");
		assertThat(q.getValueSet()).containsExactly("0", "1", "2");
	}

	@Test
	public void greaterIsAskedAsLessEqual() {
		Question q = new QuestionBuilder(QuestionOperator.GREATER, 5).getQuestions().get(0);
		assertThat(q.getOperator()).isEqualTo(QuestionOperator.LESS_EQUAL);
		assertThat(q.getValueSetName()).isEqualTo("5");
		q = new QuestionBuilder(QuestionOperator.GREATER_EQUAL, 5).getQuestions().get(0);
		assertThat(q.getOperator()).isEqualTo(QuestionOperator.LESS);
		assertThat(q.getValueSet()).containsExactly("0", "1", "2", "3", "4");
	}

	@Test
	public void negativeThresholdIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new QuestionBuilder(QuestionOperator.LESS, -1));
	}

	@Test
	public void lessPatternsCoverExactlyTheSmallerIntegers() {
		for (int v = 0; v <= 1100; v++) {
			List<String> patterns = QuestionBuilder.buildLessQuestionValueSetStartsWithDigit(v);
			for (String p : patterns) {
				boolean allWild = true;
				for (char c : p.toCharArray())
					if (c != Question.WILDCARD)
						allWild = false;
				assertWithMessage("pattern %s for %s", p, v).that(allWild).isFalse();
			}
			for (int n = 0; n <= 1200; n++)
				assertWithMessage("%s < %s", n, v)
					.that(Question.matchPattern(patterns, Integer.toString(n))).isEqualTo(n < v);
		}
	}

	@Test
	public void lessValueSetKeepsRemainder() {
		// 1000 to 1004 come from the zero-padded remainder
		List<String> patterns = QuestionBuilder.buildLessQuestionValueSet(1005);
		assertThat(patterns).containsAtLeast("???", "1000", "1004");
		assertThat(Question.matchPattern(patterns, "1002")).isTrue();
		assertThat(Question.matchPattern(patterns, "1005")).isFalse();
	}

	@Test
	public void extendQuestionMark() {
		List<String> values = QuestionBuilder.extendQuestionMarkInValueSet(Arrays.asList("a", "?"));
		assertThat(values).hasSize(11);
		assertThat(values.get(0)).isEqualTo("a");
	}

	@Test
	public void equalPerEnumConstant() {
		QuestionBuilder b = new QuestionBuilder(Stress.class);
		b.buildQuestions("Stress", "&", "#");
		Question q = find(b.getQuestions(), "Stress==SECONDARY");
		assertThat(q.getValueSet()).containsExactly("2");
		assertThat(q.getExpression()).isEqualTo("QS Stress==SECONDARY { \"*&2#*\" }");
	}

	@Test
	public void equalPerNamedValue() {
		Map<String, Integer> values = new LinkedHashMap<String, Integer>();
		values.put("Noun", 1);
		values.put("Verb", 2);
		QuestionBuilder b = new QuestionBuilder(values);
		b.buildQuestions("Pos", "=", "@");
		assertThat(find(b.getQuestions(), "Pos==Verb").getValueSet()).containsExactly("2");
	}

	@Test
	public void integerRange() {
		QuestionBuilder b = new QuestionBuilder(0, 3);
		b.buildQuestions("Count", "|", "|");
		List<String> names = new ArrayList<String>();
		for (Question q : b.getQuestions())
			names.add(q.getName());
		// the smallest value needs no LessEqual
		assertThat(names).containsExactly("Count==0", "Count==1", "Count==2", "Count==3",
										  "Count<=1", "Count<=2", "Count<=3").inOrder();
		assertThat(find(b.getQuestions(), "Count<=1").getValueSet()).containsExactly("0", "1");
	}

	@Test
	public void valueTypeSelectsOperators() {
		List<Integer> values = Arrays.asList(1, 2, 7);
		QuestionBuilder enumerable = new QuestionBuilder(values, 0, 5, QuestionBuilder.ValueType.ENUMERABLE);
		assertThat(enumerable.getQuestions()).hasSize(2);
		QuestionBuilder both = new QuestionBuilder(values, 2, 0, QuestionBuilder.ValueType.NULL);
		assertThat(both.getQuestions()).hasSize(4);
	}

	@Test
	public void phoneQuestionsMustCoverInventory() throws Exception {
		String file = "QS 'L_Vowel' {\"a-*\",\"e-*\"}\n" +
			"QS 'L_Nasal' {\"m-*\",\"n-*\"}\n";
		QuestionBuilder b = new QuestionBuilder(new BufferedReader(new StringReader(file)),
												Arrays.asList("a", "e", "m", "n"));
		b.buildQuestions(FeatureSchema.TRIPHONE, 0);
		Question vowel = find(b.getQuestions(), FeatureSchema.LEFT_PHONE+"_Vowel");
		assertThat(vowel.getExpression()).isEqualTo("QS "+FeatureSchema.LEFT_PHONE+"_Vowel { \"a-*\",\"e-*\" }");

		assertThrows(CoverageException.class,
					 () -> new QuestionBuilder(new BufferedReader(new StringReader(file)),
											   Arrays.asList("a", "e", "m", "n", "k")));
	}

	@Test
	public void notApplicableQuestion() {
		assertThat(QuestionBuilder.buildNotApplicableFeatureQuestion("Pos", "=", "@"))
			.isEqualTo("QS Pos==null { \"*=null@*\" }");
	}
}
