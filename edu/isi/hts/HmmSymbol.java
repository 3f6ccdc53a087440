package edu.isi.hts;

/** tags of the binary model format; each is written as ':' and its code byte */
public enum HmmSymbol {
	BEGIN_HMM(0),
	USE_MAC(1),
	END_HMM(2),
	NUM_MIXES(3),
	NUM_STATES(4),
	STREAM_INFO(5),
	VEC_SIZE(6),
	MSD_INFO(7),
	N_DUR(8),
	P_DUR(9),
	G_DUR(10),
	REL_DUR(11),
	GEN_DUR(12),
	DIAG_COV(13),
	FULL_COV(14),
	XFORM_COV(15),
	STATE(16),
	TMIX(17),
	MIXTURE(18),
	STREAM(19),
	S_WEIGHT(20),
	MEAN(21),
	VARIANCE(22),
	INV_COVAR(23),
	XFORM(24),
	G_CONST(25),
	DURATION(26),
	INV_DIAG_COV(27),
	TRANS_P(28),
	D_PROB(29),
	LLT_COV(30),
	LLT_COVAR(31),
	HMM_SET_ID(119),
	PARM_KIND(120),
	MACRO(121),
	EOF_SYM(122),
	NULL_SYM(123);

	private final int code;
	private HmmSymbol(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}

	/** symbol with this code, NULL_SYM for codes the format does not define */
	public static HmmSymbol fromCode(int code) {
		for (HmmSymbol s : values())
			if (s.code == code)
				return s;
		return NULL_SYM;
	}
}
