package edu.isi.hts;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads stream macro names such as <code>a_lsp_s3_4</code> (phone a,
 * state 3) or <code>logF0_s2_1-2</code> (any phone, stream 2).
 */
public class HmmStreamName {
	public static final int NO_STREAM_INDEX = -1;

	private static Pattern statePat = Pattern.compile("_s(\\d+)_");

	/** leading phone, or "*" when the name starts with a model type */
	public static String parsePhone(String macro) {
		String first = null;
		for (String s : macro.split("_")) {
			if (s.length() > 0) {
				first = s;
				break;
			}
		}
		if (first == null)
			return "";
		if (HmmModelType.fromAcousticName(first) != HmmModelType.INVALID)
			return DecisionTreeName.ANY_PHONE;
		return first;
	}

	public static HmmModelType parseModelType(String macro) {
		for (HmmModelType t : HmmModelType.values()) {
			if (!t.hasAcousticName())
				continue;
			String acoustic = t.getAcousticName();
			if (macro.indexOf("_"+acoustic+"_") > 0 || macro.startsWith(acoustic+"_"))
				return t;
		}
		return HmmModelType.INVALID;
	}

	/** state index, 0 if the name has none */
	public static int parseStateIndex(String macro) {
		Matcher m = statePat.matcher(macro);
		if (!m.find())
			return 0;
		return Integer.parseInt(m.group(1));
	}

	/** single digit after a trailing '-', or NO_STREAM_INDEX */
	public static int parseStreamIndex(String macro) {
		if (macro.length() >= 2 && macro.charAt(macro.length()-2) == '-' &&
			Character.isDigit(macro.charAt(macro.length()-1)))
			return macro.charAt(macro.length()-1) - '0';
		return NO_STREAM_INDEX;
	}

	/** the name without its trailing stream index */
	public static String getStreamIndexFreeName(String macro) {
		if (parseStreamIndex(macro) != NO_STREAM_INDEX)
			return macro.substring(0, macro.length()-2);
		return macro;
	}
}
