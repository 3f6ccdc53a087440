package edu.isi.hts;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Arrays;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FeatureSchemaTest {

	@Test
	public void triphoneSeparators() {
		FeatureSchema s = FeatureSchema.TRIPHONE;
		assertThat(s.size()).isEqualTo(3);
		assertThat(s.getLeftSeparator(0)).isEmpty();
		assertThat(s.getRightSeparator(0)).isEqualTo("-");
		assertThat(s.getLeftSeparator(2)).isEqualTo("+");
		assertThat(s.getRightSeparator(2)).isEmpty();
		assertThat(s.split("ax-b+eh")).asList().containsExactly("ax", "b", "eh").inOrder();
		assertThat(s.indexOf(FeatureSchema.CENTRAL_PHONE)).isEqualTo(1);
		assertThat(s.indexOf("Nothing")).isEqualTo(-1);
	}

	@Test
	public void splitDropsEmptyPieces() {
		assertThat(FeatureSchema.TRIPHONE.split("-b+")).asList().containsExactly("b");
	}

	@Test
	public void createRejectsTwoFeatures() {
		assertThrows(StructuralInvariantException.class,
					 () -> FeatureSchema.create("two", Arrays.asList("A", "B")));
	}

	@Test
	public void createRejectsEmptySchema() {
		assertThrows(StructuralInvariantException.class,
					 () -> FeatureSchema.create("none", Arrays.<String>asList()));
	}

	@Test
	public void createRejectsMoreFeaturesThanSeparators() {
		assertThrows(StructuralInvariantException.class,
					 () -> FeatureSchema.create("long", Arrays.asList("A", "B", "C", "D"), "-+"));
	}

	@Test
	public void createRejectsRepeatedFeature() {
		assertThrows(ConflictException.class,
					 () -> FeatureSchema.create("dup", Arrays.asList("A", "B", "A")));
	}

	@Test
	public void registryKnowsBuiltInSchemas() throws Exception {
		FeatureSchemaRegistry registry = new FeatureSchemaRegistry();
		assertThat(registry.get("Triphone")).isSameInstanceAs(FeatureSchema.TRIPHONE);
		assertThat(registry.get("Mono")).isSameInstanceAs(FeatureSchema.MONOPHONE);
		assertThrows(UndefinedReferenceException.class, () -> registry.get("Full"));
	}

	@Test
	public void registryRejectsSecondSchemaOfSameName() throws Exception {
		FeatureSchemaRegistry registry = new FeatureSchemaRegistry();
		FeatureSchema full = registry.create("Full", Arrays.asList("L", "C", "R", "Pos"));
		assertThat(registry.get("Full")).isSameInstanceAs(full);
		assertThat(full.getRightSeparator(2)).isEqualTo("+");
		assertThrows(ConflictException.class, () -> registry.create("Full", Arrays.asList("L", "C", "R")));
		assertThrows(ConflictException.class, () -> registry.create("Triphone", Arrays.asList("L", "C", "R")));
	}
}
