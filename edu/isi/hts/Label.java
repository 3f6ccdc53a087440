package edu.isi.hts;

/**
 * A context label: one value per feature of a {@link FeatureSchema}.
 * Parsed text is kept and handed back unchanged by {@link #toString()};
 * setters drop it through {@link #invalidate()} and it is rebuilt on demand.
 * Equality is over that text, so labels of different schemas with the same
 * text are equal.
 */
public class Label {
	private FeatureSchema schema;
	// null until a value other than NOT_APPLICABLE is set
	private String[] values;
	private String text;

	public Label() {
		this(FeatureSchema.TRIPHONE);
	}

	public Label(FeatureSchema schema) {
		this.schema = schema;
	}

	public Label(Label other) {
		schema = other.schema;
		values = other.values == null ? null : other.values.clone();
		text = other.text;
	}

	/**
	 * Parse label text. A single token makes a mono label; otherwise the number
	 * of tokens must equal the schema size.
	 */
	public static Label parse(String text, FeatureSchema schema) throws DataFormatException {
		boolean debug = false;
		if (text == null || text.trim().length() == 0)
			throw new DataFormatException("Empty label");
		String[] tokens = schema.split(text);
		if (debug) Debug.debug(debug, text+" split into "+tokens.length+" tokens under "+schema);
		Label ret;
		if (tokens.length == 1) {
			ret = new Label(FeatureSchema.MONOPHONE);
		}
		else if (tokens.length == 2) {
			throw new DataFormatException("Label "+text+" has two features; that is never valid");
		}
		else {
			if (tokens.length != schema.size())
				throw new DataFormatException("Label "+text+" has "+tokens.length+" features but schema "+
											  schema+" has "+schema.size());
			ret = new Label(schema);
		}
		for (int i = 0; i < tokens.length; i++)
			ret.setValue(i, tokens[i]);
		ret.text = text;
		return ret;
	}

	public FeatureSchema getSchema() { return schema; }

	public int size() { return schema.size(); }

	public String getValue(int i) {
		if (i < 0 || i >= schema.size())
			throw new IndexOutOfBoundsException("Feature index "+i+" outside schema "+schema);
		return values == null ? FeatureSchema.NOT_APPLICABLE : values[i];
	}

	public void setValue(int i, String value) {
		if (i < 0 || i >= schema.size())
			throw new IndexOutOfBoundsException("Feature index "+i+" outside schema "+schema);
		if (values == null) {
			if (FeatureSchema.NOT_APPLICABLE.equals(value))
				return;
			values = new String[schema.size()];
			for (int j = 0; j < values.length; j++)
				values[j] = FeatureSchema.NOT_APPLICABLE;
		}
		if (!values[i].equals(value)) {
			values[i] = value;
			invalidate();
		}
	}

	public String getFeatureValue(String feature) {
		return getValue(indexOf(feature));
	}

	public void setFeatureValue(String feature, String value) {
		setValue(indexOf(feature), value);
	}

	public boolean hasFeature(String feature) {
		return schema.contains(feature);
	}

	private int indexOf(String feature) {
		int i = schema.indexOf(feature);
		if (i < 0)
			throw new IllegalArgumentException("Feature "+feature+" is not in schema "+schema);
		return i;
	}

	/** true until some feature is set to a real value */
	public boolean isSparse() {
		return values == null;
	}

	// mandatory slots
	public String getLeftPhone() {
		return schema.isMono() ? null : getValue(0);
	}
	public String getCentralPhone() {
		return schema.isMono() ? getValue(0) : getValue(1);
	}
	public String getRightPhone() {
		return schema.isMono() ? null : getValue(2);
	}
	public void setCentralPhone(String phone) {
		setValue(schema.isMono() ? 0 : 1, phone);
	}

	/**
	 * Move to another schema. New slots are NOT_APPLICABLE; slots beyond a
	 * smaller schema are dropped, which callers must check for themselves.
	 */
	public void resize(FeatureSchema newSchema) {
		if (values != null) {
			String[] resized = new String[newSchema.size()];
			for (int i = 0; i < resized.length; i++)
				resized[i] = i < values.length ? values[i] : FeatureSchema.NOT_APPLICABLE;
			values = resized;
		}
		schema = newSchema;
		invalidate();
	}

	/** forget the cached text */
	public void invalidate() {
		text = null;
	}

	public String toString() {
		if (text == null) {
			StringBuilder sb = new StringBuilder();
			for (int i = 0; i < schema.size(); i++) {
				sb.append(getValue(i));
				sb.append(schema.getRightSeparator(i));
			}
			text = sb.toString();
		}
		return text;
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Label))
			return false;
		return toString().equals(o.toString());
	}

	public int hashCode() {
		return toString().hashCode();
	}
}
