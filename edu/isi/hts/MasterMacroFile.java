package edu.isi.hts;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Text model file: a ~o block of global options, then ~v variance floors,
 * ~t transitions, ~s streams and ~h models in any order. Inside a model a
 * state or transition either names an earlier global macro or embeds it.
 * Every float is written as %e.
 */
public class MasterMacroFile {
	public static final String STREAM_INFO = "<STREAMINFO>";
	public static final String MSD_INFO = "<MSDINFO>";
	public static final String VEC_SIZE = "<VECSIZE>";
	public static final String BEGIN_HMM = "<BEGINHMM>";
	public static final String END_HMM = "<ENDHMM>";
	public static final String NUM_STATES = "<NUMSTATES>";
	public static final String STATE = "<STATE>";
	public static final String STREAM_WEIGHTS = "<SWEIGHTS>";
	public static final String STREAM = "<STREAM>";
	public static final String NUM_MIXES = "<NUMMIXES>";
	public static final String MIXTURE = "<MIXTURE>";
	public static final String MEAN = "<MEAN>";
	public static final String VARIANCE = "<VARIANCE>";
	public static final String G_CONST = "<GCONST>";
	public static final String TRANS_P = "<TRANSP>";

	private int[] streamInfo;
	private int[] msdInfo;
	private int vecSize;
	private String[] vecInfo;
	private Map<String, VarianceFloor> varianceFloors = new LinkedHashMap<String, VarianceFloor>();
	private Map<String, Transition> transitions = new LinkedHashMap<String, Transition>();
	private Map<String, HmmStream> streams = new LinkedHashMap<String, HmmStream>();
	private Map<String, HmmModel> models = new LinkedHashMap<String, HmmModel>();

	public MasterMacroFile() {
	}

	public MasterMacroFile(File file, String encoding)
		throws IOException, DataFormatException, DimensionMismatchException, UndefinedReferenceException {
		this(new BufferedReader(new InputStreamReader(new FileInputStream(file), encoding)));
	}

	/** read a whole file; the reader is closed */
	public MasterMacroFile(BufferedReader br)
		throws IOException, DataFormatException, DimensionMismatchException, UndefinedReferenceException {
		RewindableReader in = new RewindableReader(br);
		try {
			load(in);
		}
		finally {
			in.close();
		}
	}

	private void load(RewindableReader in)
		throws IOException, DataFormatException, DimensionMismatchException, UndefinedReferenceException {
		boolean debug = false;
		String line;
		while ((line = in.readLine()) != null) {
			if (line.trim().length() == 0)
				continue;
			MacroName macro = MacroName.parse(line);
			if (debug) Debug.debug(debug, "Reading "+macro+" at line "+in.getLineNumber());
			switch (macro.getSymbol()) {
			case 'o':
				readGlobalOptions(in);
				break;
			case 'v':
				checkNew(varianceFloors, macro, in);
				varianceFloors.put(macro.getName(), new VarianceFloor(macro.getName(), readTagArray(in, VARIANCE)));
				break;
			case 't':
				checkNew(transitions, macro, in);
				transitions.put(macro.getName(), new Transition(macro.getName(), readTransition(in)));
				break;
			case 's': {
				checkNew(streams, macro, in);
				HmmStream stream = readStream(in);
				stream.setName(macro.getName());
				streams.put(macro.getName(), stream);
				break;
			}
			case 'h':
				checkNew(models, macro, in);
				models.put(macro.getName(), readModel(macro.getName(), in));
				break;
			default:
				throw new DataFormatException("Macro type ~"+macro.getSymbol()+" is not supported, line "+
											  in.getLineNumber());
			}
		}
	}

	private static void checkNew(Map<String, ?> table, MacroName macro, RewindableReader in) throws DataFormatException {
		if (table.containsKey(macro.getName()))
			throw new DataFormatException("Macro "+macro+" defined twice, line "+in.getLineNumber());
	}

	private void readGlobalOptions(RewindableReader in) throws IOException, DataFormatException {
		for (String line : in.readLines(new String[] { MacroName.INDICATOR }, false)) {
			if (line.trim().length() == 0)
				continue;
			String[] items = line.trim().split("\\s+");
			if (items.length <= 1)
				throw new DataFormatException("Global option \""+line+"\" should be <TAG> value...");
			if (items[0].equals(STREAM_INFO))
				streamInfo = parseSizedArray(items, line);
			else if (items[0].equals(MSD_INFO))
				msdInfo = parseSizedArray(items, line);
			else if (items[0].startsWith(VEC_SIZE))
				readVecSize(line.trim().substring(VEC_SIZE.length()));
			else
				throw new DataFormatException("Global option \""+line+"\" is not supported");
		}
	}

	// <TAG> n v1 ... vn
	private static int[] parseSizedArray(String[] items, String line) throws DataFormatException {
		int[] values = new int[items.length-1];
		for (int i = 1; i < items.length; i++)
			values[i-1] = parseInt(items[i], line);
		if (values[0] != values.length-1)
			throw new DataFormatException("Option \""+line+"\" declares "+values[0]+" values but has "+
										  (values.length-1));
		int[] ret = new int[values.length-1];
		System.arraycopy(values, 1, ret, 0, ret.length);
		return ret;
	}

	// 39<NULLD><MFCC><DIAGC>
	private void readVecSize(String rest) throws DataFormatException {
		List<String> items = new ArrayList<String>();
		for (String s : rest.split("[ <>]+"))
			if (s.length() > 0)
				items.add(s);
		if (items.isEmpty())
			throw new DataFormatException("Option "+VEC_SIZE+" without a size");
		vecSize = parseInt(items.get(0), VEC_SIZE+rest);
		vecInfo = items.subList(1, items.size()).toArray(new String[0]);
	}

	private static int parseInt(String s, String line) throws DataFormatException {
		try {
			return Integer.parseInt(s);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Expected an integer but found \""+s+"\" in \""+line+"\"", e);
		}
	}

	private static double[] parseDoubleArray(String line) throws DataFormatException {
		String t = line.trim();
		if (t.length() == 0)
			return new double[0];
		String[] items = t.split("\\s+");
		double[] ret = new double[items.length];
		for (int i = 0; i < items.length; i++) {
			try {
				ret[i] = Double.parseDouble(items[i]);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Expected a number but found \""+items[i]+"\" in \""+line+"\"", e);
			}
		}
		return ret;
	}

	private static String next(RewindableReader in) throws IOException, DataFormatException {
		String line = in.readLine();
		if (line == null)
			throw new DataFormatException("Model file ends in the middle of a macro");
		return line.trim();
	}

	private static String peek(RewindableReader in) throws IOException {
		String line = in.peekLine();
		return line == null ? "" : line.trim();
	}

	private static void ensure(String line, String expected, RewindableReader in) throws DataFormatException {
		if (!line.equals(expected))
			throw new DataFormatException("Expected "+expected+" but found \""+line+"\", line "+in.getLineNumber());
	}

	private static String[] tagValues(String line, String tag, RewindableReader in) throws DataFormatException {
		if (!line.startsWith(tag))
			throw new DataFormatException("Expected "+tag+" but found \""+line+"\", line "+in.getLineNumber());
		String[] items = line.split("\\s+");
		String[] ret = new String[items.length-1];
		System.arraycopy(items, 1, ret, 0, ret.length);
		return ret;
	}

	private static int tagValue(String line, String tag, RewindableReader in) throws DataFormatException {
		String[] items = tagValues(line, tag, in);
		if (items.length != 1)
			throw new DataFormatException("Expected "+tag+" and one value but found \""+line+"\", line "+
										  in.getLineNumber());
		return parseInt(items[0], line);
	}

	// <TAG> n, then the n values on the next line unless n is 0
	private static double[] readTagArray(RewindableReader in, String tag) throws IOException, DataFormatException {
		int size = tagValue(next(in), tag, in);
		if (size == 0)
			return new double[0];
		double[] ret = parseDoubleArray(next(in));
		if (ret.length != size)
			throw new DataFormatException(tag+" declares "+size+" values but has "+ret.length+", line "+
										  in.getLineNumber());
		return ret;
	}

	private static double[][] readTransition(RewindableReader in) throws IOException, DataFormatException {
		int size = tagValue(next(in), TRANS_P, in);
		List<String> lines = new ArrayList<String>();
		for (String line : in.readLines(new String[] { "<", MacroName.INDICATOR }, false))
			if (line.trim().length() > 0)
				lines.add(line);
		if (lines.size() != size)
			throw new DataFormatException(TRANS_P+" declares "+size+" rows but has "+lines.size()+", line "+
										  in.getLineNumber());
		double[][] ret = new double[size][];
		for (int i = 0; i < size; i++) {
			ret[i] = parseDoubleArray(lines.get(i));
			if (ret[i].length != size)
				throw new DataFormatException(TRANS_P+" row "+(i+1)+" has "+ret[i].length+" values instead of "+size);
		}
		return ret;
	}

	private static HmmStream readStream(RewindableReader in)
		throws IOException, DataFormatException, DimensionMismatchException {
		if (peek(in).startsWith(STREAM))
			tagValue(next(in), STREAM, in);
		int count = 1;
		if (peek(in).startsWith(NUM_MIXES))
			count = tagValue(next(in), NUM_MIXES, in);
		Gaussian[] gaussians = new Gaussian[count];
		for (int i = 0; i < count; i++) {
			double weight = 1.0;
			if (peek(in).startsWith(MIXTURE)) {
				String line = next(in);
				String[] values = tagValues(line, MIXTURE, in);
				if (values.length != 2)
					throw new DataFormatException("Expected "+MIXTURE+" index weight but found \""+line+"\"");
				int index = parseInt(values[0], line);
				if (index != i+1)
					throw new DataFormatException("Mixture "+index+" found where "+(i+1)+" was expected, line "+
												  in.getLineNumber());
				weight = parseDoubleArray(values[1])[0];
			}
			double[] mean = readTagArray(in, MEAN);
			double[] variance = readTagArray(in, VARIANCE);
			gaussians[i] = new Gaussian(weight, mean, variance);
			if (peek(in).startsWith(G_CONST)) {
				String line = next(in);
				String[] values = tagValues(line, G_CONST, in);
				if (values.length != 1)
					throw new DataFormatException("Expected a single value after "+G_CONST+" in \""+line+"\"");
				gaussians[i].setGlobalConstant(parseDoubleArray(values[0])[0]);
			}
		}
		return new HmmStream(null, gaussians);
	}

	private HmmState readState(RewindableReader in)
		throws IOException, DataFormatException, DimensionMismatchException, UndefinedReferenceException {
		HmmState state = new HmmState();
		tagValue(next(in), STATE, in);
		if (peek(in).startsWith(STREAM_WEIGHTS)) {
			// weights and their values line
			next(in);
			next(in);
		}
		String line = peek(in);
		if (line.startsWith(MacroName.INDICATOR)) {
			while (line.startsWith(MacroName.INDICATOR+"s")) {
				MacroName macro = MacroName.parse(next(in));
				if (!streams.containsKey(macro.getName()))
					throw new UndefinedReferenceException("Stream "+macro+" is used before it is defined, line "+
														  in.getLineNumber());
				state.addStream(Macro.<HmmStream>reference(macro.getName()));
				line = peek(in);
			}
			if (state.getStreams().isEmpty())
				throw new DataFormatException("Expected a ~s stream reference but found \""+line+"\", line "+
											  in.getLineNumber());
		}
		else if (line.startsWith(STREAM)) {
			while (line.startsWith(STREAM)) {
				state.addStream(Macro.inline(readStream(in)));
				line = peek(in);
			}
		}
		else if (line.startsWith(NUM_MIXES) || line.startsWith(MIXTURE) || line.startsWith(MEAN)) {
			state.addStream(Macro.inline(readStream(in)));
		}
		else {
			throw new DataFormatException("State without streams at \""+line+"\", line "+in.getLineNumber());
		}
		return state;
	}

	private HmmModel readModel(String name, RewindableReader in)
		throws IOException, DataFormatException, DimensionMismatchException, UndefinedReferenceException {
		HmmModel model = new HmmModel(name);
		ensure(next(in), BEGIN_HMM, in);
		int stateCount = tagValue(next(in), NUM_STATES, in);
		// entry and exit states carry no streams
		for (int i = 1; i < stateCount-1; i++)
			model.addState(readState(in));
		String line = peek(in);
		if (line.startsWith(MacroName.INDICATOR+"t")) {
			MacroName macro = MacroName.parse(next(in));
			if (!transitions.containsKey(macro.getName()))
				throw new UndefinedReferenceException("Transition "+macro+" is used before it is defined, line "+
													  in.getLineNumber());
			model.setTransition(Macro.<Transition>reference(macro.getName()));
		}
		else if (line.startsWith(TRANS_P)) {
			model.setTransition(Macro.inline(new Transition(null, readTransition(in))));
		}
		ensure(next(in), END_HMM, in);
		return model;
	}

	public int[] getStreamInfo() { return streamInfo; }
	public void setStreamInfo(int[] s) { streamInfo = s; }
	public int[] getMsdInfo() { return msdInfo; }
	public void setMsdInfo(int[] m) { msdInfo = m; }
	public int getVecSize() { return vecSize; }
	public void setVecSize(int v) { vecSize = v; }
	public String[] getVecInfo() { return vecInfo; }
	public void setVecInfo(String[] v) { vecInfo = v; }

	public Map<String, VarianceFloor> getVarianceFloors() {
		return Collections.unmodifiableMap(varianceFloors);
	}

	public Map<String, Transition> getTransitions() {
		return Collections.unmodifiableMap(transitions);
	}

	public Map<String, HmmStream> getStreams() {
		return Collections.unmodifiableMap(streams);
	}

	public Map<String, HmmModel> getModels() {
		return Collections.unmodifiableMap(models);
	}

	public void addVarianceFloor(VarianceFloor v) {
		varianceFloors.put(v.getName(), v);
	}

	public void addTransition(Transition t) {
		transitions.put(t.getName(), t);
	}

	public void addStream(HmmStream s) {
		streams.put(s.getName(), s);
	}

	public void addModel(HmmModel m) {
		models.put(m.getName(), m);
	}

	/** a stream of some model: the embedded one or the global definition */
	public HmmStream resolve(Macro<HmmStream> m) throws UndefinedReferenceException {
		return m.resolve(streams);
	}

	/**
	 * Clamp the variance of every Gaussian, global streams and embedded ones,
	 * to the floor.
	 */
	public void correctVariance(double[] floor) throws DimensionMismatchException, UndefinedReferenceException {
		for (HmmStream s : streams.values())
			for (Gaussian g : s.getGaussians())
				if (g.getLength() > 0)
					g.floorVariance(floor);
		for (HmmModel m : models.values())
			m.correctVariance(floor, streams);
	}

	private static String format(double d) {
		return String.format(Locale.ROOT, "%e", d);
	}

	private static String join(double[] values) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < values.length; i++) {
			if (i > 0)
				sb.append(' ');
			sb.append(format(values[i]));
		}
		return sb.toString();
	}

	private static String join(int[] values) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < values.length; i++) {
			if (i > 0)
				sb.append(' ');
			sb.append(values[i]);
		}
		return sb.toString();
	}

	/** options, transitions, variance floors, streams, then models */
	public void save(Writer w) throws IOException, DataFormatException, UndefinedReferenceException {
		saveGlobalOptions(w);
		for (Transition t : transitions.values())
			w.write(new MacroName('t', t.getName())+"\n"+toString(t));
		for (VarianceFloor v : varianceFloors.values())
			w.write(new MacroName('v', v.getName())+"\n"+VARIANCE+" "+v.getLength()+"\n "+join(v.getVariance())+"\n");
		for (HmmStream s : streams.values())
			w.write(new MacroName('s', s.getName())+"\n"+toString(s));
		for (HmmModel m : models.values())
			w.write(toString(m));
		w.flush();
	}

	private void saveGlobalOptions(Writer w) throws IOException {
		w.write(MacroName.INDICATOR+"o\n");
		if (streamInfo != null && streamInfo.length > 0)
			w.write(STREAM_INFO+" "+streamInfo.length+" "+join(streamInfo)+"\n");
		if (msdInfo != null && msdInfo.length > 0)
			w.write(MSD_INFO+" "+msdInfo.length+" "+join(msdInfo)+"\n");
		StringBuilder sb = new StringBuilder();
		sb.append(VEC_SIZE).append(' ').append(vecSize);
		if (vecInfo != null)
			for (String s : vecInfo)
				sb.append('<').append(s).append('>');
		w.write(sb+"\n");
	}

	private static String toString(Transition t) {
		StringBuilder sb = new StringBuilder();
		sb.append(TRANS_P).append(' ').append(t.getSize()).append('\n');
		for (double[] row : t.getMatrix()) {
			for (double d : row)
				sb.append(' ').append(format(d));
			sb.append('\n');
		}
		return sb.toString();
	}

	private static String toString(HmmStream s) {
		StringBuilder sb = new StringBuilder();
		Gaussian[] gs = s.getGaussians();
		if (gs.length > 1)
			sb.append(NUM_MIXES).append(' ').append(gs.length).append('\n');
		for (int i = 0; i < gs.length; i++) {
			if (gs.length > 1)
				sb.append(MIXTURE).append(' ').append(i+1).append(' ').append(format(gs[i].getWeight())).append('\n');
			sb.append(toString(gs[i]));
		}
		return sb.toString();
	}

	private static String toString(Gaussian g) {
		StringBuilder sb = new StringBuilder();
		if (g.getLength() == 0) {
			sb.append(MEAN).append(" 0\n").append(VARIANCE).append(" 0\n");
			sb.append(G_CONST).append(' ').append(format(g.getGlobalConstant())).append('\n');
			return sb.toString();
		}
		sb.append(MEAN).append(' ').append(g.getLength()).append("\n ").append(join(g.getMean())).append('\n');
		sb.append(VARIANCE).append(' ').append(g.getLength()).append("\n ").append(join(g.getVariance())).append('\n');
		if (g.getGlobalConstant() != 0)
			sb.append(G_CONST).append(' ').append(format(g.getGlobalConstant())).append('\n');
		return sb.toString();
	}

	private String toString(HmmModel m) throws DataFormatException, UndefinedReferenceException {
		if (m.getStates().isEmpty())
			throw new DataFormatException("Model "+m.getName()+" has no states");
		StringBuilder sb = new StringBuilder();
		sb.append(new MacroName('h', m.getName())).append('\n');
		sb.append(BEGIN_HMM).append('\n');
		sb.append(NUM_STATES).append(' ').append(m.getStates().size()+2).append('\n');
		for (int i = 0; i < m.getStates().size(); i++) {
			sb.append(STATE).append(' ').append(i+DecisionForest.STATE_INDEX_BEGIN_OFFSET).append('\n');
			List<Macro<HmmStream>> ss = m.getStates().get(i).getStreams();
			for (int j = 0; j < ss.size(); j++) {
				Macro<HmmStream> s = ss.get(j);
				if (s.isReference()) {
					s.resolve(streams);
					sb.append(new MacroName('s', s.getName())).append('\n');
				}
				else {
					sb.append(STREAM).append(' ').append(j+1).append('\n');
					sb.append(toString(s.getValue()));
				}
			}
		}
		Macro<Transition> t = m.getTransition();
		if (t != null) {
			if (t.isReference()) {
				t.resolve(transitions);
				sb.append(new MacroName('t', t.getName())).append('\n');
			}
			else {
				sb.append(toString(t.getValue()));
			}
		}
		sb.append(END_HMM).append('\n');
		return sb.toString();
	}
}
