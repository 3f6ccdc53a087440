package edu.isi.hts;

import gnu.trove.list.array.TIntArrayList;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the parts of a tree name such as <code>{*-a+*}[3].stream[2,3,4]</code>:
 * the phone the tree is for, the HMM state and the streams.
 */
public class DecisionTreeName {
	/** phone of a phone-independent tree */
	public static final String ANY_PHONE = "*";

	private static Pattern streamPat = Pattern.compile("stream\\[(.+)\\]");
	private static Pattern statePat = Pattern.compile("\\{.+?\\}\\[(.+?)\\]");
	private static Pattern phonePat = Pattern.compile("\\{\\*\\-(\\w+)\\+\\*\\}");
	private static Pattern anyPhonePat = Pattern.compile("\\{\\*\\}");

	/** the listed streams; {1} if only a state is given */
	public static int[] parseStreamIndexes(String name) throws DataFormatException {
		Matcher m = streamPat.matcher(name);
		if (!m.find()) {
			if (!hasStateIndex(name))
				throw new DataFormatException("Tree name "+name+" has no stream information");
			return new int[] { 1 };
		}
		TIntArrayList ret = new TIntArrayList();
		for (String item : m.group(1).split(",")) {
			try {
				ret.add(Integer.parseInt(item.trim()));
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Bad stream index "+item+" in tree name "+name, e);
			}
		}
		return ret.toArray();
	}

	public static boolean hasStateIndex(String name) {
		return statePat.matcher(name).find();
	}

	/** HTK state index, counted from 2 */
	public static int parseStateIndex(String name) throws DataFormatException {
		Matcher m = statePat.matcher(name);
		if (!m.find())
			throw new DataFormatException("Tree name "+name+" has no state information");
		try {
			return Integer.parseInt(m.group(1));
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Bad state index in tree name "+name, e);
		}
	}

	/** phone of the tree, ANY_PHONE, or "" if neither form is present */
	public static String parsePhone(String name) {
		Matcher m = phonePat.matcher(name);
		if (m.find())
			return m.group(1);
		if (anyPhonePat.matcher(name).find())
			return ANY_PHONE;
		return "";
	}

	/** the name with its stream list replaced, whatever spacing the old list had */
	public static String replaceStreams(String name, int[] newIndexes) throws DataFormatException {
		Matcher m = streamPat.matcher(name);
		if (!m.find())
			throw new DataFormatException("Tree name "+name+" has no stream list to replace");
		return name.substring(0, m.start(1))+join(newIndexes)+name.substring(m.end(1));
	}

	static String join(int[] indexes) {
		StringBuilder sb = new StringBuilder();
		for (int i : indexes) {
			if (sb.length() > 0)
				sb.append(',');
			sb.append(i);
		}
		return sb.toString();
	}
}
