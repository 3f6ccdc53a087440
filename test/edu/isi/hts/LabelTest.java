package edu.isi.hts;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Arrays;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LabelTest {

	private static FeatureSchema fourSlots() throws Exception {
		return FeatureSchema.create("Four", Arrays.asList(FeatureSchema.LEFT_PHONE, FeatureSchema.CENTRAL_PHONE,
														  FeatureSchema.RIGHT_PHONE, "Position"), "-+=");
	}

	@Test
	public void parsesTriphone() throws Exception {
		Label label = Label.parse("ax-b+eh", FeatureSchema.TRIPHONE);
		assertThat(label.getLeftPhone()).isEqualTo("ax");
		assertThat(label.getCentralPhone()).isEqualTo("b");
		assertThat(label.getRightPhone()).isEqualTo("eh");
		assertThat(label.getFeatureValue(FeatureSchema.CENTRAL_PHONE)).isEqualTo("b");
		assertThat(label.toString()).isEqualTo("ax-b+eh");
	}

	@Test
	public void singleTokenIsMono() throws Exception {
		Label label = Label.parse("sil", FeatureSchema.TRIPHONE);
		assertThat(label.getSchema()).isSameInstanceAs(FeatureSchema.MONOPHONE);
		assertThat(label.getCentralPhone()).isEqualTo("sil");
		assertThat(label.getLeftPhone()).isNull();
		assertThat(label.getRightPhone()).isNull();
		assertThat(label.toString()).isEqualTo("sil");
	}

	@Test
	public void twoTokensAreRejected() {
		assertThrows(DataFormatException.class, () -> Label.parse("a-b", FeatureSchema.TRIPHONE));
	}

	@Test
	public void tokenCountMustMatchSchema() throws Exception {
		FeatureSchema schema = fourSlots();
		assertThrows(DataFormatException.class, () -> Label.parse("a-b+c", schema));
		assertThat(Label.parse("a-b+c=3", schema).getFeatureValue("Position")).isEqualTo("3");
	}

	@Test
	public void setterRebuildsText() throws Exception {
		Label label = Label.parse("ax-b+eh", FeatureSchema.TRIPHONE);
		label.setCentralPhone("x");
		assertThat(label.toString()).isEqualTo("ax-x+eh");
		label.setFeatureValue(FeatureSchema.RIGHT_PHONE, "y");
		assertThat(label.toString()).isEqualTo("ax-x+y");
	}

	@Test
	public void newLabelIsSparse() {
		Label label = new Label(FeatureSchema.TRIPHONE);
		assertThat(label.isSparse()).isTrue();
		assertThat(label.getCentralPhone()).isEqualTo(FeatureSchema.NOT_APPLICABLE);
		label.setValue(1, FeatureSchema.NOT_APPLICABLE);
		assertThat(label.isSparse()).isTrue();
		label.setValue(1, "a");
		assertThat(label.isSparse()).isFalse();
		assertThat(label.toString()).isEqualTo("null-a+null");
	}

	@Test
	public void resizePadsWithNotApplicable() throws Exception {
		Label label = Label.parse("a-b+c", FeatureSchema.TRIPHONE);
		label.resize(fourSlots());
		assertThat(label.getFeatureValue("Position")).isEqualTo(FeatureSchema.NOT_APPLICABLE);
		assertThat(label.toString()).isEqualTo("a-b+c=null");
	}

	@Test
	public void unknownFeatureIsAnError() throws Exception {
		Label label = Label.parse("a-b+c", FeatureSchema.TRIPHONE);
		assertThrows(IllegalArgumentException.class, () -> label.getFeatureValue("Position"));
	}

	@Test
	public void equalityFollowsText() throws Exception {
		Label a = Label.parse("a-b+c", FeatureSchema.TRIPHONE);
		Label b = new Label(FeatureSchema.TRIPHONE);
		b.setValue(0, "a");
		b.setValue(1, "b");
		b.setValue(2, "c");
		assertThat(b).isEqualTo(a);
		assertThat(b.hashCode()).isEqualTo(a.hashCode());
		assertThat(new Label(a)).isEqualTo(a);
	}
}
