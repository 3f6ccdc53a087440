package edu.isi.hts;

import java.util.Map;

/**
 * A use of a macro inside a model: either the definition itself, embedded,
 * or the name of a global definition looked up when needed.
 */
public class Macro<T> {
	private final String name;
	private final T value;

	private Macro(String name, T value) {
		this.name = name;
		this.value = value;
	}

	public static <T> Macro<T> inline(T value) {
		if (value == null)
			throw new IllegalArgumentException("Embedded macro without a value");
		return new Macro<T>(null, value);
	}

	public static <T> Macro<T> reference(String name) {
		if (name == null || name.length() == 0)
			throw new IllegalArgumentException("Macro reference without a name");
		return new Macro<T>(name, null);
	}

	public boolean isReference() {
		return name != null;
	}

	/** the referenced name; null when embedded */
	public String getName() { return name; }

	/** the embedded value; null for a reference */
	public T getValue() { return value; }

	/** the embedded value, or the global definition of the name */
	public T resolve(Map<String, T> table) throws UndefinedReferenceException {
		if (!isReference())
			return value;
		T ret = table.get(name);
		if (ret == null)
			throw new UndefinedReferenceException("Macro \""+name+"\" is referenced but not defined");
		return ret;
	}

	public String toString() {
		return isReference() ? "\""+name+"\"" : "<inline "+value+">";
	}
}
