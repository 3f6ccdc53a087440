package edu.isi.hts;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class HtsCluster {
	// version number
	static final String VERSION = "1.0";

	// create a summary of a forest and add it to a buffer
	static void getForestCheck(StringBuffer buffer, DecisionForest forest) throws DataFormatException {
		buffer.append("Forest info for "+forest.getName()+":\n");
		buffer.append("\t"+forest.getQuestions().size()+" questions\n");
		buffer.append("\t"+forest.getTrees().size()+" trees\n");
		buffer.append("\t"+forest.getNonLeafNodes().size()+" non-leaf nodes\n");
		buffer.append("\t"+forest.getLeafNodes().size()+" leaves\n");
		int[] perStream = forest.getTreeCountsByStream().toArray();
		for (int s = 1; s < perStream.length; s++)
			if (perStream[s] > 0)
				buffer.append("\t"+perStream[s]+" trees on stream "+s+"\n");
	}

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		// format of the input and output data - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
				"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"time",
				"print timing information for steps at or below level <time>");
		jsap.registerParameter(timeopt);

		// layout of full context labels; the triphone layout otherwise
		FlaggedOption featuresopt = new FlaggedOption("features",
				FileStringParser.getParser().setMustExist(true),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"features",
				"file listing the feature names of a label, one per line. Only used with --classify "+
				"and --triphones. Labels are triphones (l-c+r) if absent");
		jsap.registerParameter(featuresopt);

		// OPTIONS REGARDING THE OPERATIONS TO PERFORM:

		FlaggedOption deleteopt = new FlaggedOption("delete",
				StringStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"delete-leaves",
				"comma separated names of leaves to remove; each is replaced by its sibling");
		jsap.registerParameter(deleteopt);

		FlaggedOption pruneopt = new FlaggedOption("prune",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"prune-stream",
				"remove stream <prune-stream> from every tree that has it");
		jsap.registerParameter(pruneopt);

		Switch resortsw = new Switch("resort",
				JSAP.NO_SHORTFLAG,
				"resort",
				"keep only the questions some tree asks");
		jsap.registerParameter(resortsw);

		FlaggedOption classifyopt = new FlaggedOption("classify",
				StringStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"classify",
				"print the leaf the label <classify> reaches in every tree of its phone");
		jsap.registerParameter(classifyopt);

		FlaggedOption triphoneopt = new FlaggedOption("triphones",
				FileStringParser.getParser().setMustExist(true),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"triphones",
				"given a file of phones, print the triphones reaching every leaf");
		jsap.registerParameter(triphoneopt);

		FlaggedOption checkopt = new FlaggedOption("check",
				FileStringParser.getParser().setMustExist(true),
				null,
				false,
				'c',
				"check",
				"verify that every leaf names a stream of the text model file <check>");
		jsap.registerParameter(checkopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt = new FlaggedOption("outfile",
				FileStringParser.getParser(),
				null,
				false,
				'o',
				"outfile",
				"file to write the forest or report to. If absent, writing is done to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption infileopt = new UnflaggedOption("infiles",
				FileStringParser.getParser(),
				null,
				true,
				true,
				"list of forest files. Several forests are combined into one: trees by name, "+
				"questions must agree");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);

		// at most one report
		int numActive = 0;
		if (config.contains("classify"))
			numActive++;
		if (config.contains("triphones"))
			numActive++;
		if (config.contains("check"))
			numActive++;
		if (numActive > 1)
			throw new ConfigureException("Only one of --classify, --triphones and --check may be used at once");

		if (config.contains("features") && !config.contains("classify") && !config.contains("triphones"))
			throw new ConfigureException("--features only applies to --classify and --triphones");

		if (config.contains("prune") && config.getInt("prune") < 1)
			throw new ConfigureException("Stream indexes start at 1, not "+config.getInt("prune"));

		return config;
	}

	static BufferedReader open(File f, String encoding) throws FileNotFoundException, IOException {
		return new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
	}

	static DecisionForest readForest(File f, String encoding)
		throws IOException, DataFormatException, UndefinedReferenceException {
		BufferedReader br = open(f, encoding);
		try {
			return new DecisionForest(f.getName(), br);
		}
		finally {
			br.close();
		}
	}

	static FeatureSchema readSchema(File f, String encoding)
		throws IOException, StructuralInvariantException, ConflictException {
		List<String> features = new ArrayList<String>();
		BufferedReader br = open(f, encoding);
		try {
			String line;
			while ((line = br.readLine()) != null) {
				line = line.trim();
				if (line.length() > 0 && !line.startsWith("#"))
					features.add(line);
			}
		}
		finally {
			br.close();
		}
		return new FeatureSchemaRegistry().create(f.getName(), features);
	}

	/**
	 * Load, combine and modify the forests, then write the forest or the
	 * requested report.
	 * @return 0, or 1 if --check found leaves without a stream
	 */
	static int process(JSAPResult config, String encoding, Writer w) throws Exception {
		boolean debug = false;
		int timeLevel = config.contains("time") ? config.getInt("time") : -1;

		Date preReadTime = new Date();
		File[] infiles = config.getFileArray("infiles");
		List<DecisionForest> forests = new ArrayList<DecisionForest>();
		for (File f : infiles)
			forests.add(readForest(f, encoding));
		DecisionForest forest = forests.size() == 1 ? forests.get(0) :
			DecisionForest.combine(infiles[0].getName(), forests);
		Debug.dbtime(timeLevel, 1, preReadTime, new Date(), "read "+infiles.length+" forests");

		if (config.contains("delete")) {
			List<String> names = new ArrayList<String>();
			for (String s : config.getString("delete").split(","))
				if (s.trim().length() > 0)
					names.add(s.trim());
			int removed = forest.deleteLeaves(names);
			if (debug) Debug.debug(debug, "Removed "+removed+" leaves");
			if (removed < names.size())
				Debug.prettyDebug("Only "+removed+" of "+names.size()+" leaves were found and removed");
		}
		if (config.contains("prune"))
			forest.pruneStream(new int[] { config.getInt("prune") });
		if (config.getBoolean("resort"))
			forest.reSortQuestions();

		StringBuffer summary = new StringBuffer();
		getForestCheck(summary, forest);
		Debug.prettyDebug(summary.toString());

		FeatureSchema schema = FeatureSchema.TRIPHONE;
		if (config.contains("features"))
			schema = readSchema(config.getFile("features"), encoding);

		int ret = 0;
		if (config.contains("classify")) {
			Label label = Label.parse(config.getString("classify"), schema);
			List<DecisionTree> trees = forest.matchingTrees(label);
			List<DecisionTreeNode> leaves = forest.filter(label);
			for (int i = 0; i < trees.size(); i++)
				w.write(trees.get(i).getName()+"\t"+leaves.get(i).getName()+"\n");
		}
		else if (config.contains("triphones")) {
			BufferedReader br = open(config.getFile("triphones"), encoding);
			Phoneme phones;
			try {
				phones = new Phoneme(br);
			}
			finally {
				br.close();
			}
			Map<String, TriphoneSet> sets = ForestFilter.getSelectiveTriphones(forest, phones.getPhones(), schema);
			for (Map.Entry<String, TriphoneSet> e : sets.entrySet()) {
				StringBuilder sb = new StringBuilder(e.getKey());
				for (Label l : e.getValue().getAllTriphones())
					sb.append(' ').append(l);
				w.write(sb.append('\n').toString());
			}
		}
		else if (config.contains("check")) {
			MasterMacroFile mmf = new MasterMacroFile(config.getFile("check"), encoding);
			int missing = 0;
			for (DecisionTreeNode leaf : forest.getLeafNodes()) {
				if (!mmf.getStreams().containsKey(leaf.getName())) {
					w.write("missing stream for leaf "+leaf.getName()+"\n");
					missing++;
				}
			}
			w.write(forest.getLeafNodes().size()+" leaves checked, "+missing+" without a stream\n");
			if (missing > 0)
				ret = 1;
		}
		else {
			forest.save(w);
		}
		w.flush();
		return ret;
	}

	public static void main(String argv[]) throws Exception {
		Debug.prettyDebug("This is HtsCluster, version "+VERSION);

		// parameter processor and configuration settings
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		// encoding of read and written files
		String encoding = null;
		// where we're writing
		File outfile = null;

		try {
			config = processParameters(jsap, argv);
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time"))
				Debug.setDbLevel(config.getInt("time"));
			outfile = config.getFile("outfile");
		}
		catch (JSAPException e) {
			System.err.println("HtsCluster options improperly configured: "+e.getMessage());
			System.err.println("Try 'htscluster -h` for a detailed help message");
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("HtsCluster options improperly configured: "+e.getMessage());
			System.err.println("Try 'htscluster -h` for a detailed help message");
			System.exit(1);
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: htscluster ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			System.exit(0);
		}

		if (!config.success()) {
			for (java.util.Iterator errs = config.getErrorMessageIterator(); errs.hasNext();)
				Debug.prettyDebug("Error: "+errs.next());
			Debug.prettyDebug("Usage: htscluster ");
			Debug.prettyDebug("             "+jsap.getUsage());
			System.exit(1);
		}

		int status = 0;
		Writer w = null;
		try {
			if (outfile != null)
				w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
			else
				w = new OutputStreamWriter(System.out, encoding);
			status = process(config, encoding, w);
		}
		catch (FileNotFoundException e) {
			System.err.println("Input file not found: "+e.getMessage());
			System.exit(1);
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading input file: "+e.getMessage());
			System.exit(1);
		}
		catch (UndefinedReferenceException e) {
			System.err.println("Undefined reference: "+e.getMessage());
			System.exit(1);
		}
		catch (ConflictException e) {
			System.err.println("Conflicting definitions: "+e.getMessage());
			System.exit(1);
		}
		catch (StructuralInvariantException e) {
			System.err.println("Improper operation: "+e.getMessage());
			System.exit(1);
		}
		catch (DimensionMismatchException e) {
			System.err.println("Mismatched dimensions: "+e.getMessage());
			System.exit(1);
		}
		catch (IOException e) {
			System.err.println("Problem processing input file: "+e.getMessage());
			System.exit(1);
		}
		finally {
			if (w != null)
				w.close();
		}
		if (status != 0)
			System.exit(status);
	}
}
