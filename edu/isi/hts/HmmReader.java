package edu.isi.hts;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads binary HTK model files. Records start with <code>~t </code> where t
 * is the macro type; inside a record every tag is ':' and a code byte
 * ({@link HmmSymbol}), numbers are little-endian and arrays are an int16
 * count followed by the values. The reader only moves forward.
 */
public class HmmReader implements Closeable {
	/** returned by {@link #readNextMacro()} at end of data */
	public static final char NO_MACRO = 0;
	private static final String MACRO_TYPES = "smuxdcrpabgfyjvitwho";

	/** called per macro by {@link #forEachMacro}; false stops the scan */
	public interface MacroVisitor {
		public boolean visit(char type, HmmReader reader)
			throws IOException, DataFormatException, DimensionMismatchException;
	}

	private final PushbackInputStream in;
	private short[] streamWidths;
	private short[] msdInfo;

	public HmmReader(File file) throws FileNotFoundException {
		this(new BufferedInputStream(new FileInputStream(file)));
	}

	public HmmReader(InputStream stream) {
		in = new PushbackInputStream(stream, 2);
	}

	public void close() throws IOException {
		in.close();
	}

	// one byte, failing at end of data
	private int readByte() throws IOException, DataFormatException {
		int b = in.read();
		if (b < 0)
			throw new DataFormatException("Model data ends in the middle of a record");
		return b;
	}

	public short readInt16() throws IOException, DataFormatException {
		int lo = readByte();
		int hi = readByte();
		return (short)((hi << 8) | lo);
	}

	public int readInt32() throws IOException, DataFormatException {
		int b0 = readByte();
		int b1 = readByte();
		int b2 = readByte();
		int b3 = readByte();
		return (b3 << 24) | (b2 << 16) | (b1 << 8) | b0;
	}

	public float readFloat() throws IOException, DataFormatException {
		return Float.intBitsToFloat(readInt32());
	}

	/**
	 * Move to the next macro.
	 * @return its type, lower-cased, or NO_MACRO at end of data
	 */
	public char readNextMacro() throws IOException {
		int sym = ' ';
		while (true) {
			if (sym != '~') {
				sym = in.read();
				if (sym < 0)
					return NO_MACRO;
			}
			if (sym == '~') {
				sym = in.read();
				if (sym < 0)
					return NO_MACRO;
				if (sym != '~') {
					char type = Character.toLowerCase((char)sym);
					sym = in.read();
					if (sym < 0)
						return NO_MACRO;
					// a '~' inside a quoted name is not followed by type and blank
					if (MACRO_TYPES.indexOf(type) >= 0 && (sym == ' ' || sym == '\n'))
						return type;
				}
			}
		}
	}

	/** skip to the next tag; EOF_SYM at end of data */
	public HmmSymbol readNextSymbol() throws IOException {
		int b;
		do {
			b = in.read();
			if (b < 0)
				return HmmSymbol.EOF_SYM;
		} while (b != ':');
		int code = in.read();
		if (code < 0)
			return HmmSymbol.EOF_SYM;
		return HmmSymbol.fromCode(code);
	}

	/** the tag starting right here, without consuming it; NULL_SYM if there is none */
	public HmmSymbol peekSymbol() throws IOException {
		int b = in.read();
		if (b < 0)
			return HmmSymbol.EOF_SYM;
		if (b != ':') {
			in.unread(b);
			return HmmSymbol.NULL_SYM;
		}
		int code = in.read();
		if (code < 0) {
			in.unread(b);
			return HmmSymbol.EOF_SYM;
		}
		in.unread(code);
		in.unread(b);
		return HmmSymbol.fromCode(code);
	}

	private void expect(HmmSymbol got, HmmSymbol want) throws DataFormatException {
		if (got != want)
			throw new DataFormatException("Expected "+want+" in model data but read "+got);
	}

	/** a double-quoted name, after any blanks */
	public String readString() throws IOException, DataFormatException {
		int b;
		do {
			b = readByte();
		} while (b == ' ' || b == '\n' || b == '\r' || b == '\t');
		if (b != '"')
			throw new DataFormatException("Expected a quoted name in model data but read '"+(char)b+"'");
		StringBuilder sb = new StringBuilder();
		while ((b = readByte()) != '"')
			sb.append((char)b);
		return sb.toString();
	}

	public short[] readInt16Array() throws IOException, DataFormatException {
		short n = readInt16();
		if (n < 0)
			throw new DataFormatException("Negative array length "+n+" in model data");
		short[] ret = new short[n];
		for (int i = 0; i < n; i++)
			ret[i] = readInt16();
		return ret;
	}

	public double[] readFloatArray() throws IOException, DataFormatException {
		short n = readInt16();
		if (n < 0)
			throw new DataFormatException("Negative array length "+n+" in model data");
		double[] ret = new double[n];
		for (int i = 0; i < n; i++)
			ret[i] = readFloat();
		return ret;
	}

	/** square matrix after &lt;TRANSP&gt; */
	public double[][] readTransMatrix() throws IOException, DataFormatException {
		expect(readNextSymbol(), HmmSymbol.TRANS_P);
		short n = readInt16();
		if (n < 0)
			throw new DataFormatException("Negative state count "+n+" in transition matrix");
		double[][] ret = new double[n][n];
		for (int i = 0; i < n; i++)
			for (int j = 0; j < n; j++)
				ret[i][j] = readFloat();
		return ret;
	}

	public double[] readVariance() throws IOException, DataFormatException {
		expect(readNextSymbol(), HmmSymbol.VARIANCE);
		return readFloatArray();
	}

	/**
	 * The mixture of a stream: an optional &lt;NUMMIXES&gt; count, then per
	 * Gaussian an optional &lt;MIXTURE&gt; index and weight, mean, variance and
	 * an optional &lt;GCONST&gt;. A lone Gaussian without weight gets weight 1.
	 */
	public Gaussian[] readGaussians() throws IOException, DataFormatException, DimensionMismatchException {
		boolean debug = false;
		HmmSymbol symbol = readNextSymbol();
		if (symbol != HmmSymbol.MEAN && symbol != HmmSymbol.NUM_MIXES && symbol != HmmSymbol.MIXTURE) {
			// a leading tag such as <STREAM>
			if (debug) Debug.debug(debug, "Skipping "+symbol+" before mixture");
			symbol = readNextSymbol();
		}
		int count = 1;
		if (symbol == HmmSymbol.NUM_MIXES) {
			count = readInt32();
			if (count <= 0)
				throw new DataFormatException("Mixture count "+count+" in model data");
			symbol = readNextSymbol();
		}
		Gaussian[] ret = new Gaussian[count];
		for (int i = 0; i < count; i++) {
			double weight = 1.0;
			if (symbol == HmmSymbol.MIXTURE) {
				readInt16();
				weight = readFloat();
				symbol = readNextSymbol();
			}
			expect(symbol, HmmSymbol.MEAN);
			double[] mean = readFloatArray();
			expect(readNextSymbol(), HmmSymbol.VARIANCE);
			double[] variance = readFloatArray();
			ret[i] = new Gaussian(weight, mean, variance);
			if (peekSymbol() == HmmSymbol.G_CONST) {
				readNextSymbol();
				ret[i].setGlobalConstant(readFloat());
			}
			if (i < count-1)
				symbol = readNextSymbol();
		}
		return ret;
	}

	/** name and mixture of a ~s or ~p definition */
	public HmmStream readStream() throws IOException, DataFormatException, DimensionMismatchException {
		String name = readString();
		return new HmmStream(name, readGaussians());
	}

	/** body of the ~o macro: &lt;STREAMINFO&gt; and an optional &lt;MSDINFO&gt; */
	public short[] readStreamInfo() throws IOException, DataFormatException {
		expect(readNextSymbol(), HmmSymbol.STREAM_INFO);
		streamWidths = readInt16Array();
		if (peekSymbol() == HmmSymbol.MSD_INFO) {
			readNextSymbol();
			msdInfo = readInt16Array();
		}
		return streamWidths.clone();
	}

	/** widths read by the last {@link #readStreamInfo()}, or null */
	public short[] getStreamWidths() {
		return streamWidths == null ? null : streamWidths.clone();
	}

	/** MSD flags read by the last {@link #readStreamInfo()}, or null */
	public short[] getMsdInfo() {
		return msdInfo == null ? null : msdInfo.clone();
	}

	/** visit macros up to and including the first model (~h) */
	public void forEachMacro(MacroVisitor visitor) throws IOException, DataFormatException, DimensionMismatchException {
		char type;
		while ((type = readNextMacro()) != NO_MACRO) {
			if (!visitor.visit(type, this))
				return;
			if (type == 'h')
				return;
		}
	}

	/** every stream defined before the first model */
	public List<HmmStream> readStreams() throws IOException, DataFormatException, DimensionMismatchException {
		final List<HmmStream> ret = new ArrayList<HmmStream>();
		forEachMacro(new MacroVisitor() {
				public boolean visit(char type, HmmReader reader)
					throws IOException, DataFormatException, DimensionMismatchException {
					switch (type) {
					case 'p':
					case 's':
						ret.add(reader.readStream());
						break;
					case 't':
						reader.readString();
						reader.readTransMatrix();
						break;
					case 'v':
						reader.readString();
						reader.readVariance();
						break;
					case 'o':
						reader.readStreamInfo();
						break;
					default:
						break;
					}
					return true;
				}
			});
		return ret;
	}

	/**
	 * Widths of the given streams (1-based), from the ~o macro.
	 * @return null if the data has no ~o macro before the first model
	 */
	public int[] readStreamWidths(final int[] streamIndexes) throws IOException, DataFormatException, DimensionMismatchException {
		final int[][] ret = new int[1][];
		forEachMacro(new MacroVisitor() {
				public boolean visit(char type, HmmReader reader) throws IOException, DataFormatException {
					if (type != 'o')
						return true;
					short[] widths = reader.readStreamInfo();
					int[] picked = new int[streamIndexes.length];
					for (int i = 0; i < streamIndexes.length; i++) {
						int s = streamIndexes[i];
						if (s < 1 || s > widths.length)
							throw new DataFormatException("No stream "+s+" among the "+widths.length+" in model data");
						picked[i] = widths[s-1];
					}
					ret[0] = picked;
					return false;
				}
			});
		return ret[0];
	}

	/**
	 * Second pass over a whole file: for each defined stream whose name
	 * contains stateTag, the models using it. Streams met before the first
	 * model are definitions; after it they are references of the current model.
	 */
	public Map<String, List<String>> getStateAndModelMapping(String stateTag)
		throws IOException, DataFormatException, DimensionMismatchException {
		Map<String, List<String>> ret = new LinkedHashMap<String, List<String>>();
		boolean inModels = false;
		String model = null;
		char type;
		while ((type = readNextMacro()) != NO_MACRO) {
			switch (type) {
			case 'p':
			case 's': {
				String state = readString();
				if (inModels) {
					List<String> users = ret.get(state);
					if (users != null)
						users.add(model);
				}
				else {
					if (state.contains(stateTag))
						ret.put(state, new ArrayList<String>());
					readGaussians();
				}
				break;
			}
			case 't':
				if (!inModels) {
					readString();
					readTransMatrix();
				}
				break;
			case 'v':
				readString();
				if (!inModels)
					readVariance();
				break;
			case 'h':
				model = readString();
				inModels = true;
				break;
			default:
				break;
			}
		}
		return ret;
	}

	/**
	 * Second pass over a whole file: for each model, its stream names
	 * indexed by [state][stream].
	 */
	public Map<String, String[][]> getModelAndStateMapping()
		throws IOException, DataFormatException, DimensionMismatchException {
		Map<String, List<String>> models = new LinkedHashMap<String, List<String>>();
		int streamCount = -1;
		boolean inModels = false;
		String model = null;
		char type;
		while ((type = readNextMacro()) != NO_MACRO) {
			switch (type) {
			case 'p':
			case 's': {
				String state = readString();
				if (inModels)
					models.get(model).add(state);
				else
					readGaussians();
				break;
			}
			case 't':
				if (!inModels) {
					readString();
					readTransMatrix();
				}
				break;
			case 'v':
				readString();
				if (!inModels)
					readVariance();
				break;
			case 'h':
				model = readString();
				if (!models.containsKey(model))
					models.put(model, new ArrayList<String>());
				inModels = true;
				break;
			case 'o':
				streamCount = readStreamInfo().length;
				break;
			default:
				break;
			}
		}
		if (streamCount <= 0 && !models.isEmpty())
			throw new DataFormatException("Model data has no stream information");
		Map<String, String[][]> ret = new LinkedHashMap<String, String[][]>();
		for (Map.Entry<String, List<String>> e : models.entrySet()) {
			List<String> streams = e.getValue();
			if (streams.size() % streamCount != 0)
				throw new DataFormatException("Model "+e.getKey()+" has "+streams.size()+
											  " streams, not a multiple of "+streamCount);
			int states = streams.size() / streamCount;
			String[][] table = new String[states][streamCount];
			for (int i = 0; i < states; i++)
				for (int j = 0; j < streamCount; j++)
					table[i][j] = streams.get(i*streamCount+j);
			ret.put(e.getKey(), table);
		}
		return ret;
	}

	/** all streams defined in a file before its first model */
	public static List<HmmStream> readStreams(File file) throws IOException, DataFormatException, DimensionMismatchException {
		HmmReader reader = new HmmReader(file);
		try {
			return reader.readStreams();
		}
		finally {
			reader.close();
		}
	}
}
