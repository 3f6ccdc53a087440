package edu.isi.hts;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Phone inventory of a voice. Silence and short pause are spelled
 * differently in the lexicon, at runtime and in HTK files; inventories
 * always hold the HTK spelling.
 */
public class Phoneme {
	public static final String SILENCE = "sil";
	public static final String RUNTIME_SILENCE = "-sil-";
	public static final String HTK_SILENCE = "SIL";
	public static final String SHORT_PAUSE = "sp";
	public static final String RUNTIME_SHORT_PAUSE = "-sp-";
	public static final String HTK_SHORT_PAUSE = "SP";

	private static Pattern spacePat = Pattern.compile("\\s+");

	private final SortedSet<String> phones = new TreeSet<String>();

	public Phoneme(Collection<String> phones) {
		for (String p : phones)
			this.phones.add(toHtk(p));
	}

	/** whitespace separated phones; lines starting with # are comments */
	public Phoneme(BufferedReader br) throws IOException {
		String line;
		while ((line = br.readLine()) != null) {
			line = line.trim();
			if (line.length() == 0 || line.startsWith("#"))
				continue;
			for (String p : spacePat.split(line))
				phones.add(toHtk(p));
		}
	}

	public SortedSet<String> getPhones() {
		return Collections.unmodifiableSortedSet(phones);
	}

	public boolean contains(String phone) {
		return phones.contains(phone);
	}

	public int size() {
		return phones.size();
	}

	public static boolean isSilencePhone(String phone) {
		return SILENCE.equalsIgnoreCase(phone) || RUNTIME_SILENCE.equalsIgnoreCase(phone);
	}

	public static boolean isShortPausePhone(String phone) {
		return SHORT_PAUSE.equalsIgnoreCase(phone) || RUNTIME_SHORT_PAUSE.equalsIgnoreCase(phone);
	}

	public static boolean isSilenceFeature(String phone) {
		return isSilencePhone(phone) || isShortPausePhone(phone);
	}

	public static String toHtk(String phone) {
		if (isSilencePhone(phone))
			return HTK_SILENCE;
		if (isShortPausePhone(phone))
			return HTK_SHORT_PAUSE;
		return phone;
	}

	public String toString() {
		return phones.toString();
	}
}
