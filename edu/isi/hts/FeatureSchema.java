package edu.isi.hts;

import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of named context features and the separator characters that
 * delimit them in a label. Slot i is followed by separator i; the first three
 * slots are the left, central and right phone.
 * Schemas are shared by every label built over them and never change.
 */
public class FeatureSchema {

	/** the full-context separator alphabet, in label order */
	public static final String DEFAULT_SEPARATORS = "-++|&&;;#|='':$~!--@@%;$$!+:=|##&~^:+&-;||%~'" +
		"=@!^=^~#:&%+@'-!;=$&@|~-'^%#;:#$;+!!$|^'+%:-=&:@~$=%|+;-^&'~@;!#!~+^$:|-&=#%@-:';&+~%" +
		"!=-#^|$@+=!'|@^#~&^;%$'&!:%-$#@=:~;'%'!&|:;~|'@$-|!%&#+#=+$^+-~=;@:^!|;^@&$+'#-%==~~::!@#'$%%^^-";

	public static final String LEFT_PHONE = "Phone.PrevPhone.PhoneIdentity";
	public static final String CENTRAL_PHONE = "Phone.PhoneIdentity";
	public static final String RIGHT_PHONE = "Phone.NextPhone.PhoneIdentity";

	/** value of a feature that does not apply to a label */
	public static final String NOT_APPLICABLE = "null";

	/** a-b+c */
	public static final FeatureSchema TRIPHONE = new FeatureSchema("Triphone",
		new String[] { LEFT_PHONE, CENTRAL_PHONE, RIGHT_PHONE }, DEFAULT_SEPARATORS.substring(0, 2));
	public static final FeatureSchema MONOPHONE = new FeatureSchema("Mono",
		new String[] { CENTRAL_PHONE }, "");

	private final String name;
	private final String[] features;
	private final String separators;
	private final BitSet separatorSet;
	private final TObjectIntHashMap<String> index;

	private FeatureSchema(String name, String[] features, String separators) {
		this.name = name;
		this.features = features.clone();
		this.separators = separators;
		separatorSet = new BitSet();
		for (int i = 0; i < separators.length(); i++)
			separatorSet.set(separators.charAt(i));
		index = new TObjectIntHashMap<String>(features.length*2, 0.5f, -1);
		for (int i = 0; i < features.length; i++)
			index.put(features[i], i);
	}

	/**
	 * Validating factory.
	 * @throws StructuralInvariantException on an empty or two-slot schema, or
	 *   one with more slots than the alphabet can delimit
	 * @throws ConflictException if a feature name repeats
	 */
	public static FeatureSchema create(String name, List<String> features, String separators)
		throws StructuralInvariantException, ConflictException {
		if (features.isEmpty())
			throw new StructuralInvariantException("Schema "+name+" has no features");
		if (features.size() == 2)
			throw new StructuralInvariantException("Schema "+name+" has two features; a label is either "+
												   "a single phone or left, central and right phone plus extras");
		if (features.size() > separators.length()+1)
			throw new StructuralInvariantException("Schema "+name+" has "+features.size()+
												   " features but only "+separators.length()+" separators");
		FeatureSchema ret = new FeatureSchema(name, features.toArray(new String[0]), separators);
		if (ret.index.size() != features.size()) {
			for (int i = 0; i < features.size(); i++)
				if (ret.index.get(features.get(i)) != i)
					throw new ConflictException("Feature "+features.get(i)+" appears twice in schema "+name);
		}
		return ret;
	}

	public static FeatureSchema create(String name, List<String> features)
		throws StructuralInvariantException, ConflictException {
		return create(name, features, DEFAULT_SEPARATORS);
	}

	public String getName() { return name; }
	public int size() { return features.length; }
	public String getSeparators() { return separators; }
	public boolean isMono() { return features.length == 1; }

	public String getFeatureName(int i) { return features[i]; }
	public List<String> getFeatureNames() {
		return Collections.unmodifiableList(Arrays.asList(features));
	}

	/** slot of a feature, or -1 */
	public int indexOf(String feature) {
		return index.get(feature);
	}

	public boolean contains(String feature) {
		return index.containsKey(feature);
	}

	/** separator written before slot i, empty for the first slot */
	public String getLeftSeparator(int i) {
		if (i == 0 || i-1 >= separators.length())
			return "";
		return separators.substring(i-1, i);
	}

	/** separator written after slot i, empty when the alphabet is exhausted */
	public String getRightSeparator(int i) {
		if (i >= separators.length())
			return "";
		return separators.substring(i, i+1);
	}

	public boolean isSeparator(char c) {
		return separatorSet.get(c);
	}

	/** split label text on this schema's separators, dropping empty pieces */
	public String[] split(String text) {
		ArrayList<String> tokens = new ArrayList<String>();
		int start = 0;
		for (int i = 0; i <= text.length(); i++) {
			if (i == text.length() || isSeparator(text.charAt(i))) {
				if (i > start)
					tokens.add(text.substring(start, i));
				start = i+1;
			}
		}
		return tokens.toArray(new String[0]);
	}

	public String toString() {
		return name;
	}
}
