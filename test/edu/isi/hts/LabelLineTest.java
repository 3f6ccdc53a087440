package edu.isi.hts;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LabelLineTest {

	@Test
	public void parsesSegmentStateAndExtras() throws Exception {
		LabelLine line = LabelLine.parse("0 500000 ax-b+eh[2] extra");
		assertThat(line.hasSegment()).isTrue();
		assertThat(line.getStartTime()).isEqualTo(0L);
		assertThat(line.getEndTime()).isEqualTo(500000L);
		assertThat(line.getState()).isEqualTo(2);
		assertThat(line.getLabel().getCentralPhone()).isEqualTo("b");
		assertThat(line.getRemaining()).asList().containsExactly("extra");
		assertThat(line.toString()).isEqualTo("0 500000 ax-b+eh[2] extra");
		assertThat(line.toString(LabelLine.LabelType.MONO_PHONE, false)).isEqualTo("0 500000 b[2]");
	}

	@Test
	public void bareLabel() throws Exception {
		LabelLine line = LabelLine.parse("ax-b+eh");
		assertThat(line.hasSegment()).isFalse();
		assertThat(line.getState()).isEqualTo(-1);
		assertThat(line.toString()).isEqualTo("ax-b+eh");
	}

	@Test
	public void twoFieldsAreRejected() {
		assertThrows(DataFormatException.class, () -> LabelLine.parse("100 ax-b+eh"));
	}

	@Test
	public void badTimesAreRejected() {
		assertThrows(DataFormatException.class, () -> LabelLine.parse("x 100 ax-b+eh"));
	}

	@Test
	public void segmentMustNotRunBackwards() throws Exception {
		LabelLine line = LabelLine.parse("ax-b+eh");
		line.setSegment(10, 20);
		assertThat(line.toString()).isEqualTo("10 20 ax-b+eh");
		assertThrows(IllegalArgumentException.class, () -> line.setSegment(20, 10));
	}
}
