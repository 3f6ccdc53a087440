package edu.isi.hts;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The streams of one model type in a binary model file, with the widths of
 * the chosen stream indexes and the distribution they follow.
 */
public class HtsMmfFile {
	private static final Map<HmmModelType, String> algorithmIds = new EnumMap<HmmModelType, String>(HmmModelType.class);
	static {
		algorithmIds.put(HmmModelType.LSP, "Linear Spectrum Pair");
		algorithmIds.put(HmmModelType.FUNDAMENTAL_FREQUENCY, "Log Fundamental Frequency");
		algorithmIds.put(HmmModelType.STATE_DURATION, "Duration");
		algorithmIds.put(HmmModelType.PHONE_DURATION, "Phone Duration");
		algorithmIds.put(HmmModelType.MBE, "Multi-Band Excitation");
		algorithmIds.put(HmmModelType.POWER, "Power");
		algorithmIds.put(HmmModelType.GUIDANCE_LSP, "GuidanceLsp");
	}

	private final HmmModelType modelType;
	private File file;
	private int[] streamIndexes;
	private int[] streamWidths;
	private List<HmmStream> streams = new ArrayList<HmmStream>();
	private Map<String, HmmStream> namedStreams = new LinkedHashMap<String, HmmStream>();
	private ModelDistributionType distribution = ModelDistributionType.NOT_DEFINED;

	public HtsMmfFile(HmmModelType modelType) {
		this.modelType = modelType;
	}

	public HmmModelType getModelType() { return modelType; }
	public File getFile() { return file; }
	public ModelDistributionType getDistribution() { return distribution; }

	/** 1-based indexes whose widths {@link #load} looks up; none by default */
	public void setStreamIndexes(int[] indexes) { streamIndexes = indexes; }
	public int[] getStreamIndexes() { return streamIndexes; }

	/** widths of the stream indexes, null if none were set or the file has no ~o */
	public int[] getStreamWidths() { return streamWidths; }

	public List<HmmStream> getStreams() {
		return Collections.unmodifiableList(streams);
	}

	public Map<String, HmmStream> getNamedStreams() {
		return Collections.unmodifiableMap(namedStreams);
	}

	/** streams of the given emitting state */
	public List<HmmStream> getStreams(int stateIndex) {
		List<HmmStream> ret = new ArrayList<HmmStream>();
		for (HmmStream s : streams)
			if (s.getStateIndex() == stateIndex)
				ret.add(s);
		return ret;
	}

	/** non-empty Gaussians of the first stream */
	public int getGaussianMixtureCount() {
		if (streams.isEmpty())
			return 0;
		int n = 0;
		for (Gaussian g : streams.get(0).getGaussians())
			if (g.getLength() > 0)
				n++;
		return n;
	}

	public String getAlgorithmId() {
		String id = algorithmIds.get(modelType);
		if (id == null)
			throw new IllegalStateException("No algorithm id for model type "+modelType);
		return id;
	}

	/**
	 * Read the streams of this model type, two passes over the file when
	 * stream widths are wanted. A stream of two Gaussians whose second is all
	 * zero makes the file MSD, anything else continuous.
	 */
	public void load(File mmf) throws IOException, DataFormatException, DimensionMismatchException {
		boolean debug = false;
		file = mmf;
		streams.clear();
		namedStreams.clear();
		for (HmmStream s : HmmReader.readStreams(mmf)) {
			if (s.getModelType() != modelType)
				continue;
			streams.add(s);
			namedStreams.put(s.getName(), s);
		}
		if (streams.isEmpty())
			throw new DataFormatException("No "+modelType.getAcousticName()+" streams in "+mmf);
		if (streamIndexes != null) {
			HmmReader reader = new HmmReader(mmf);
			try {
				streamWidths = reader.readStreamWidths(streamIndexes);
			}
			finally {
				reader.close();
			}
		}
		distribution = streams.get(0).getDistributionType();
		if (distribution == ModelDistributionType.NOT_DEFINED)
			distribution = ModelDistributionType.CONTINUOUS;
		if (debug) Debug.debug(debug, "Read "+streams.size()+" "+modelType+" streams, "+distribution);
	}
}
