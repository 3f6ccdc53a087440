package edu.isi.hts;

/**
 * Kind of acoustic model, as spelled inside stream macro names
 * (acoustic name) and in model files (label).
 */
public enum HmmModelType {
	INVALID(null, null),
	LSP("lsp", "LSP"),
	FUNDAMENTAL_FREQUENCY("logF0", "LogF0"),
	STATE_DURATION("dur", "StateDuration"),
	VOICED_UNVOICED(null, null),
	GAIN(null, null),
	PHONE_DURATION("pdur", "PhoneDuration"),
	MBE("mbe", "MultiBandExcitation"),
	POWER("pow", "Power"),
	GUIDANCE_LSP("guidanceLsp", "GuidanceLsp"),
	PITCH_MARKER(null, null);

	private final String acousticName;
	private final String label;

	private HmmModelType(String acousticName, String label) {
		this.acousticName = acousticName;
		this.label = label;
	}

	/** name used in macro names, "" if the type has none */
	public String getAcousticName() {
		return acousticName == null ? "" : acousticName;
	}

	/** tag used in model files, "" if the type has none */
	public String getLabel() {
		return label == null ? "" : label;
	}

	public boolean hasAcousticName() {
		return acousticName != null;
	}

	/** type with this acoustic name, INVALID if none */
	public static HmmModelType fromAcousticName(String name) {
		for (HmmModelType t : values())
			if (t.acousticName != null && t.acousticName.equals(name))
				return t;
		return INVALID;
	}

	/** type with this label, INVALID if none */
	public static HmmModelType fromLabel(String label) {
		for (HmmModelType t : values())
			if (t.label != null && t.label.equals(label))
				return t;
		return INVALID;
	}
}
