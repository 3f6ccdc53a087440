package edu.isi.hts;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named group of phones, read from a phonetic question file:
 * <pre>QS 'L_Vowel' {"a-*","e-*"}</pre>
 */
public class PhoneQuestion {
	private static Pattern linePat = Pattern.compile("^\\s*QS\\s+'L_(.*)'\\s+\\{(.*)\\}\\s*$");
	private static Pattern itemPat = Pattern.compile("\"(.*)-\\*\"");
	private static Pattern itemSplitPat = Pattern.compile("[, ]+");

	private final String name;
	private final List<String> phones = new ArrayList<String>();

	public PhoneQuestion(String name) {
		this.name = name;
	}

	public PhoneQuestion(String name, List<String> phones) {
		this(name);
		for (String p : phones)
			add(p);
	}

	/** read one line; null if the line is not a phone question */
	public static PhoneQuestion parse(String line) throws DataFormatException {
		Matcher m = linePat.matcher(line.trim());
		if (!m.matches() || m.group(1).length() == 0 || m.group(2).length() == 0)
			return null;
		PhoneQuestion ret = new PhoneQuestion(m.group(1));
		for (String item : itemSplitPat.split(m.group(2).trim())) {
			if (item.length() == 0)
				continue;
			Matcher im = itemPat.matcher(item);
			if (!im.matches())
				throw new DataFormatException("Invalid item "+item+" in phone question "+ret.name);
			ret.add(im.group(1));
		}
		return ret;
	}

	/** every phone question in a file; other lines are ignored */
	public static List<PhoneQuestion> load(BufferedReader br) throws IOException, DataFormatException {
		List<PhoneQuestion> ret = new ArrayList<PhoneQuestion>();
		String line;
		while ((line = br.readLine()) != null) {
			PhoneQuestion q = parse(line);
			if (q != null)
				ret.add(q);
		}
		return ret;
	}

	private void add(String phone) {
		if (!phones.contains(phone))
			phones.add(phone);
	}

	public String getName() { return name; }
	public List<String> getPhones() { return Collections.unmodifiableList(phones); }
	public boolean contains(String phone) { return phones.contains(phone); }

	/** silence and short pause take their HTK spelling */
	public void toHtk() {
		for (int i = 0; i < phones.size(); i++)
			phones.set(i, Phoneme.toHtk(phones.get(i)));
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (String p : phones) {
			if (sb.length() > 0)
				sb.append(',');
			sb.append('"').append(p).append("-*\"");
		}
		return "QS 'L_"+name+"' {"+sb+"}";
	}
}
