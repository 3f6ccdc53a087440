package edu.isi.hts;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MasterMacroFileTest {

	@Rule public TemporaryFolder tmp = new TemporaryFolder();

	static final String SAMPLE =
		"~o\n" +
		"<STREAMINFO> 1 2\n" +
		"<MSDINFO> 1 0\n" +
		"<VECSIZE> 2<NULLD><USER><DIAGC>\n" +
		"~t \"trans1\"\n" +
		"<TRANSP> 3\n" +
		" 0.0 1.0 0.0\n" +
		" 0.0 0.5 0.5\n" +
		" 0.0 0.0 0.0\n" +
		"~v \"varFloor1\"\n" +
		"<VARIANCE> 2\n" +
		" 0.001 0.001\n" +
		"~s \"a_lsp_s2_1\"\n" +
		"<MEAN> 2\n" +
		" 1.0 2.0\n" +
		"<VARIANCE> 2\n" +
		" 0.001 0.5\n" +
		"<GCONST> 3.0\n" +
		"~h \"a\"\n" +
		"<BEGINHMM>\n" +
		"<NUMSTATES> 3\n" +
		"<STATE> 2\n" +
		"~s \"a_lsp_s2_1\"\n" +
		"~t \"trans1\"\n" +
		"<ENDHMM>\n" +
		"~h \"b\"\n" +
		"<BEGINHMM>\n" +
		"<NUMSTATES> 3\n" +
		"<STATE> 2\n" +
		"<STREAM> 1\n" +
		"<NUMMIXES> 2\n" +
		"<MIXTURE> 1 0.6\n" +
		"<MEAN> 2\n" +
		" 1.0 1.0\n" +
		"<VARIANCE> 2\n" +
		" 0.001 0.002\n" +
		"<MIXTURE> 2 0.4\n" +
		"<MEAN> 2\n" +
		" 2.0 2.0\n" +
		"<VARIANCE> 2\n" +
		" 0.3 0.3\n" +
		"<TRANSP> 3\n" +
		" 0.0 1.0 0.0\n" +
		" 0.0 0.9 0.1\n" +
		" 0.0 0.0 0.0\n" +
		"<ENDHMM>\n";

	static MasterMacroFile read(String text) throws Exception {
		return new MasterMacroFile(new BufferedReader(new StringReader(text)));
	}

	static String save(MasterMacroFile mmf) throws Exception {
		StringWriter w = new StringWriter();
		mmf.save(w);
		return w.toString();
	}

	@Test
	public void readsEveryMacro() throws Exception {
		MasterMacroFile mmf = read(SAMPLE);
		assertThat(mmf.getStreamInfo()).asList().containsExactly(2);
		assertThat(mmf.getMsdInfo()).asList().containsExactly(0);
		assertThat(mmf.getVecSize()).isEqualTo(2);
		assertThat(mmf.getVecInfo()).asList().containsExactly("NULLD", "USER", "DIAGC").inOrder();
		assertThat(mmf.getTransitions().keySet()).containsExactly("trans1");
		assertThat(mmf.getVarianceFloors().get("varFloor1").getLength()).isEqualTo(2);
		assertThat(mmf.getStreams().keySet()).containsExactly("a_lsp_s2_1");
		assertThat(mmf.getModels().keySet()).containsExactly("a", "b").inOrder();
		Gaussian g = mmf.getStreams().get("a_lsp_s2_1").getGaussians()[0];
		assertThat(g.getWeight()).isEqualTo(1.0);
		assertThat(g.getGlobalConstant()).isEqualTo(3.0);
	}

	@Test
	public void blankLinesBetweenMacros() throws Exception {
		String spaced = SAMPLE
			.replace("~t \"trans1\"\n<TRANSP>", "\n~t \"trans1\"\n<TRANSP>")
			.replace("~v ", "\n~v ")
			.replace("~s \"a_lsp_s2_1\"\n<MEAN>", "\n~s \"a_lsp_s2_1\"\n<MEAN>")
			.replace("~h ", "\n~h ") + "\n";
		MasterMacroFile mmf = read(spaced);
		assertThat(mmf.getTransitions().get("trans1").getSize()).isEqualTo(3);
		assertThat(mmf.getTransitions().get("trans1").getMatrix()[1][1]).isEqualTo(0.5);
		assertThat(mmf.getVarianceFloors().keySet()).containsExactly("varFloor1");
		assertThat(mmf.getStreams().keySet()).containsExactly("a_lsp_s2_1");
		assertThat(mmf.getModels().keySet()).containsExactly("a", "b").inOrder();
		assertThat(save(mmf)).isEqualTo(save(read(SAMPLE)));
	}

	@Test
	public void referencedAndEmbeddedMacros() throws Exception {
		MasterMacroFile mmf = read(SAMPLE);
		HmmModel a = mmf.getModels().get("a");
		assertThat(a.getStates()).hasSize(1);
		Macro<HmmStream> ref = a.getStates().get(0).getStreams().get(0);
		assertThat(ref.isReference()).isTrue();
		assertThat(ref.getName()).isEqualTo("a_lsp_s2_1");
		assertThat(mmf.resolve(ref)).isSameInstanceAs(mmf.getStreams().get("a_lsp_s2_1"));
		assertThat(a.getTransition().isReference()).isTrue();
		assertThat(a.getTransition().getName()).isEqualTo("trans1");

		HmmModel b = mmf.getModels().get("b");
		Macro<HmmStream> inline = b.getStates().get(0).getStreams().get(0);
		assertThat(inline.isReference()).isFalse();
		Gaussian[] gs = mmf.resolve(inline).getGaussians();
		assertThat(gs).hasLength(2);
		assertThat(gs[0].getWeight()).isEqualTo(0.6);
		assertThat(gs[1].getWeight()).isEqualTo(0.4);
		assertThat(gs[1].getMean()).usingExactEquality().containsExactly(2.0, 2.0);
		Transition t = b.getTransition().getValue();
		assertThat(t.getSize()).isEqualTo(3);
		assertThat(t.getMatrix()[1][2]).isEqualTo(0.1);
	}

	@Test
	public void saveThenReadGivesSameFile() throws Exception {
		MasterMacroFile mmf = read(SAMPLE);
		String text = save(mmf);
		assertThat(text).startsWith("~o\n<STREAMINFO> 1 2\n<MSDINFO> 1 0\n<VECSIZE> 2<NULLD><USER><DIAGC>\n");
		assertThat(text).contains("<MIXTURE> 1 6.000000e-01\n");
		assertThat(text).contains("<GCONST> 3.000000e+00\n");
		assertThat(text).contains("<STATE> 2\n~s \"a_lsp_s2_1\"\n~t \"trans1\"\n<ENDHMM>\n");
		MasterMacroFile again = read(text);
		assertThat(again.getModels().keySet()).containsExactly("a", "b").inOrder();
		assertThat(again.getStreams().get("a_lsp_s2_1").approximatelyEquals(mmf.getStreams().get("a_lsp_s2_1"), true))
			.isTrue();
		assertThat(save(again)).isEqualTo(text);
	}

	@Test
	public void readsFromFile() throws Exception {
		File f = tmp.newFile("sample.mmf");
		Writer w = new OutputStreamWriter(new FileOutputStream(f), "UTF-8");
		try {
			w.write(SAMPLE);
		}
		finally {
			w.close();
		}
		assertThat(new MasterMacroFile(f, "UTF-8").getModels()).hasSize(2);
	}

	@Test
	public void correctVarianceFloorsEveryGaussian() throws Exception {
		MasterMacroFile mmf = read(SAMPLE);
		mmf.correctVariance(new double[] { 0.01, 0.01 });
		assertThat(mmf.getStreams().get("a_lsp_s2_1").getGaussians()[0].getVariance())
			.usingExactEquality().containsExactly(0.01, 0.5).inOrder();
		Gaussian[] gs = mmf.resolve(mmf.getModels().get("b").getStates().get(0).getStreams().get(0)).getGaussians();
		assertThat(gs[0].getVariance()).usingExactEquality().containsExactly(0.01, 0.01);
		assertThat(gs[1].getVariance()).usingExactEquality().containsExactly(0.3, 0.3);
		assertThrows(DimensionMismatchException.class, () -> mmf.correctVariance(new double[] { 0.01 }));
	}

	@Test
	public void correctVarianceSkipsEmptyGaussians() throws Exception {
		MasterMacroFile mmf = read(
			"~s \"logF0_s2_1-2\"\n" +
			"<NUMMIXES> 2\n" +
			"<MIXTURE> 1 0.9\n" +
			"<MEAN> 1\n 5.0\n" +
			"<VARIANCE> 1\n 0.0001\n" +
			"<MIXTURE> 2 0.1\n" +
			"<MEAN> 0\n" +
			"<VARIANCE> 0\n" +
			"<GCONST> 0.0\n");
		HmmStream s = mmf.getStreams().get("logF0_s2_1-2");
		assertThat(s.getDistributionType()).isEqualTo(ModelDistributionType.MSD);
		mmf.correctVariance(new double[] { 0.01 });
		assertThat(s.getGaussians()[0].getVariance()[0]).isEqualTo(0.01);
		assertThat(save(mmf)).contains("<MEAN> 0\n<VARIANCE> 0\n<GCONST> 0.000000e+00\n");
	}

	@Test
	public void undefinedReferences() {
		String stream = SAMPLE.replace("~s \"a_lsp_s2_1\"\n~t", "~s \"missing\"\n~t");
		assertThrows(UndefinedReferenceException.class, () -> read(stream));
		String trans = SAMPLE.replace("~t \"trans1\"\n<ENDHMM>", "~t \"missing\"\n<ENDHMM>");
		assertThrows(UndefinedReferenceException.class, () -> read(trans));
	}

	@Test
	public void malformedFiles() {
		assertThrows(DataFormatException.class,
					 () -> read(SAMPLE.replace("~h \"a\"\n<BEGINHMM>\n", "~h \"a\"\n")));
		assertThrows(DataFormatException.class,
					 () -> read(SAMPLE + "~v \"varFloor1\"\n<VARIANCE> 1\n 0.1\n"));
		assertThrows(DataFormatException.class, () -> read("~x \"what\"\n"));
		assertThrows(DataFormatException.class, () -> read(SAMPLE.replace("<MIXTURE> 2 0.4", "<MIXTURE> 3 0.4")));
		assertThrows(DataFormatException.class, () -> read(SAMPLE.replace("<STREAMINFO> 1 2", "<STREAMINFO> 2 2")));
		assertThrows(DataFormatException.class, () -> read(SAMPLE.substring(0, SAMPLE.length()-"<ENDHMM>\n".length())));
		assertThrows(DimensionMismatchException.class,
					 () -> read(SAMPLE.replace("<VARIANCE> 2\n 0.001 0.5\n", "<VARIANCE> 1\n 0.001\n")));
	}

	@Test
	public void modelWithoutStatesCannotBeSaved() throws Exception {
		MasterMacroFile mmf = new MasterMacroFile();
		mmf.addModel(new HmmModel("empty"));
		assertThrows(DataFormatException.class, () -> save(mmf));
	}

	@Test
	public void builtByHand() throws Exception {
		MasterMacroFile mmf = new MasterMacroFile();
		mmf.setStreamInfo(new int[] { 1 });
		mmf.setVecSize(1);
		mmf.addTransition(new Transition("t", new double[][] { { 0, 1, 0 }, { 0, 0.5, 0.5 }, { 0, 0, 0 } }));
		mmf.addStream(new HmmStream("x_lsp_s2_1", new Gaussian[] {
			new Gaussian(1.0, new double[] { 1 }, new double[] { 2 }) }));
		HmmModel m = new HmmModel("x");
		HmmState state = new HmmState();
		state.addStream(Macro.<HmmStream>reference("x_lsp_s2_1"));
		m.addState(state);
		m.setTransition(Macro.<Transition>reference("t"));
		mmf.addModel(m);
		MasterMacroFile again = read(save(mmf));
		assertThat(again.getModels().get("x").getStates()).hasSize(1);
		assertThat(again.getStreamInfo()).asList().containsExactly(1);
		assertThrows(DimensionMismatchException.class,
					 () -> new Transition("bad", new double[][] { { 0, 1 }, { 0 } }));
	}
}
