package edu.isi.hts;

/**
 * The header line of a macro block: <code>~s "name"</code>, or just
 * <code>~o</code> for the global options.
 */
public class MacroName {
	public static final String INDICATOR = "~";

	private final char symbol;
	private final String name;

	public MacroName(char symbol, String name) {
		this.symbol = symbol;
		this.name = name == null ? "" : name;
	}

	public static MacroName parse(String line) throws DataFormatException {
		if (line == null)
			throw new DataFormatException("Expected a macro line but the file ended");
		String[] items = line.trim().split("\\s+");
		if (items.length != 1 && items.length != 2)
			throw new DataFormatException("Invalid macro line \""+line+"\", expected ~x or ~x \"name\"");
		if (!items[0].startsWith(INDICATOR))
			throw new DataFormatException("Macro line \""+line+"\" does not start with "+INDICATOR);
		if (items[0].length() != 2)
			throw new DataFormatException("Macro symbol \""+items[0].substring(1)+"\" in \""+line+
										  "\" is not a single character");
		String name = "";
		if (items.length == 2) {
			name = stripQuotes(items[1]);
			if (name.length() == 0)
				throw new DataFormatException("Empty macro name in line \""+line+"\"");
		}
		return new MacroName(items[0].charAt(1), name);
	}

	private static String stripQuotes(String s) {
		int b = 0, e = s.length();
		while (b < e && s.charAt(b) == '"')
			b++;
		while (e > b && s.charAt(e-1) == '"')
			e--;
		return s.substring(b, e);
	}

	public char getSymbol() { return symbol; }
	public String getName() { return name; }

	public String toString() {
		if (name.length() == 0)
			return INDICATOR+symbol;
		return INDICATOR+symbol+" \""+name+"\"";
	}
}
