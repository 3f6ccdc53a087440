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

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPResult;

@RunWith(JUnit4.class)
public final class HtsClusterTest {

	private static final String FOREST =
		"QS Phone.PhoneIdentity_AB { \"*-a+*\",\"*-b+*\" }\n" +
		"QS Phone.NextPhone.PhoneIdentity_A { \"*+a\" }\n" +
		"QS Pos==1 { \"*=1@*\" }\n" +
		"\n" +
		" {*}[2].stream[1]\n" +
		"{\n" +
		"   0 Phone.PhoneIdentity_AB \"lsp_s2_1\" -1\n" +
		"  -1 Phone.NextPhone.PhoneIdentity_A \"lsp_s2_2\" \"lsp_s2_3\"\n" +
		"}\n" +
		"\n";

	@Rule public TemporaryFolder tmp = new TemporaryFolder();

	private File forest;
	private File phones;
	private File features;

	private File write(String name, String text) throws Exception {
		File f = tmp.newFile(name);
		Writer w = new OutputStreamWriter(new FileOutputStream(f), "utf-8");
		try {
			w.write(text);
		}
		finally {
			w.close();
		}
		return f;
	}

	@Before
	public void writeInputs() throws Exception {
		forest = write("lsp.inf", FOREST);
		phones = write("phones.txt", "# inventory\na b\nc d\n");
		features = write("features.txt",
						 "Phone.PrevPhone.PhoneIdentity\nPhone.PhoneIdentity\nPhone.NextPhone.PhoneIdentity\n");
	}

	private static JSAPResult parse(String... argv) throws Exception {
		return HtsCluster.processParameters(new JSAP(), argv);
	}

	private static String run(JSAPResult config, int status) throws Exception {
		assertThat(config.success()).isTrue();
		StringWriter w = new StringWriter();
		assertThat(HtsCluster.process(config, "utf-8", w)).isEqualTo(status);
		return w.toString();
	}

	@Test
	public void onlyOneReportAtATime() {
		assertThrows(ConfigureException.class,
					 () -> parse("--classify", "x-a+b", "--triphones", phones.getPath(), forest.getPath()));
		assertThrows(ConfigureException.class,
					 () -> parse("--classify", "x-a+b", "-c", forest.getPath(), forest.getPath()));
	}

	@Test
	public void featuresNeedALabelReport() {
		assertThrows(ConfigureException.class, () -> parse("--features", features.getPath(), forest.getPath()));
	}

	@Test
	public void streamsStartAtOne() {
		assertThrows(ConfigureException.class, () -> parse("--prune-stream", "0", forest.getPath()));
	}

	@Test
	public void missingForestFails() throws Exception {
		assertThat(parse().success()).isFalse();
	}

	@Test
	public void classifyPrintsTreeAndLeaf() throws Exception {
		String out = run(parse("--classify", "x-a+b", forest.getPath()), 0);
		assertThat(out).isEqualTo("{*}[2].stream[1]\tlsp_s2_2\n");
	}

	@Test
	public void classifyWithFeatureFile() throws Exception {
		String out = run(parse("--classify", "x-b+a", "--features", features.getPath(), forest.getPath()), 0);
		assertThat(out).isEqualTo("{*}[2].stream[1]\tlsp_s2_3\n");
	}

	@Test
	public void classifyRejectsQuestionsOnUnknownFeatures() throws Exception {
		File hhed = write("hhed.inf",
						  "QS \"C-Vowel\" { \"*-a+*\" }\n\n {*}[2].stream[1]\n{\n   0 C-Vowel \"lsp_s2_1\" \"lsp_s2_2\"\n}\n\n");
		JSAPResult config = parse("--classify", "x-a+b", hhed.getPath());
		assertThrows(UndefinedReferenceException.class,
					 () -> HtsCluster.process(config, "utf-8", new StringWriter()));
	}

	@Test
	public void triphonesPerLeaf() throws Exception {
		String out = run(parse("--triphones", phones.getPath(), forest.getPath()), 0);
		String[] lines = out.split("\n");
		assertThat(lines).hasLength(3);
		assertThat(lines[0]).startsWith("lsp_s2_1 a-c+a a-c+b ");
		assertThat(lines[0].split(" ")).hasLength(33);
		assertThat(lines[2].split(" ")).hasLength(9);
	}

	@Test
	public void deleteAndResortThenSave() throws Exception {
		String out = run(parse("--delete-leaves", "lsp_s2_2,nosuchleaf", "--resort", forest.getPath()), 0);
		DecisionForest saved = new DecisionForest("out", new BufferedReader(new StringReader(out)));
		assertThat(saved.getQuestions().keySet()).containsExactly("Phone.PhoneIdentity_AB");
		assertThat(saved.getLeafNodes()).hasSize(2);
		assertThat(saved.getTrees().get(0).getLeafNames()).containsExactly("lsp_s2_1", "lsp_s2_3");
	}

	@Test
	public void forestsAreCombined() throws Exception {
		File second = write("more.inf",
							"QS Phone.PhoneIdentity_AB { \"*-a+*\",\"*-b+*\" }\n\n {*}[3].stream[1,2]\n   \"lsp_s3_1\"\n\n");
		String out = run(parse("--prune-stream", "2", forest.getPath(), second.getPath()), 0);
		DecisionForest saved = new DecisionForest("out", new BufferedReader(new StringReader(out)));
		assertThat(saved.getTrees()).hasSize(2);
		assertThat(saved.getTree("{*}[3].stream[1]")).isNotNull();
		assertThat(saved.getQuestions()).hasSize(3);
	}

	@Test
	public void checkReportsLeavesWithoutStreams() throws Exception {
		File mmf = write("lsp.mmf", MasterMacroFileTest.SAMPLE.replace("a_lsp_s2_1", "lsp_s2_1"));
		String out = run(parse("--check", mmf.getPath(), forest.getPath()), 1);
		assertThat(out).contains("missing stream for leaf lsp_s2_2\n");
		assertThat(out).contains("missing stream for leaf lsp_s2_3\n");
		assertThat(out).doesNotContain("leaf lsp_s2_1\n");
		assertThat(out).endsWith("3 leaves checked, 2 without a stream\n");
	}
}
