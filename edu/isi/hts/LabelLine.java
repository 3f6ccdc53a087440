package edu.isi.hts;

import java.util.regex.Pattern;

/**
 * One line of an HTK label file:
 * <pre>[start end] label[state] [extra fields...]</pre>
 * Times are in 100ns units. A missing state is -1.
 */
public class LabelLine {
	private static Pattern spacePat = Pattern.compile("\\s+");

	public enum LabelType { FULL_CONTEXT, MONO_PHONE }

	private long startTime = -1;
	private long endTime = -1;
	private int state = -1;
	private Label label;
	private String[] remaining;

	public LabelLine(Label label) {
		this.label = label;
	}

	public static LabelLine parse(String line) throws DataFormatException {
		return parse(line, FeatureSchema.TRIPHONE);
	}

	public static LabelLine parse(String line, FeatureSchema schema) throws DataFormatException {
		String[] parts = spacePat.split(line.trim());
		String labelText;
		long start = -1, end = -1;
		String[] rest = null;
		switch (parts.length) {
		case 1:
			labelText = parts[0];
			break;
		case 2:
			throw new DataFormatException("Label line \""+line+"\" has two fields");
		default:
			try {
				start = Long.parseLong(parts[0]);
				end = Long.parseLong(parts[1]);
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Bad segment times in label line \""+line+"\"", e);
			}
			labelText = parts[2];
			if (parts.length > 3) {
				rest = new String[parts.length-3];
				System.arraycopy(parts, 3, rest, 0, rest.length);
			}
		}
		int state = -1;
		// a-b+c...[state]
		if (labelText.endsWith("]")) {
			int open = labelText.lastIndexOf('[');
			if (open < 0)
				throw new DataFormatException("Unbalanced state marker in \""+labelText+"\"");
			try {
				state = Integer.parseInt(labelText.substring(open+1, labelText.length()-1));
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Bad state index in \""+labelText+"\"", e);
			}
			labelText = labelText.substring(0, open);
		}
		LabelLine ret = new LabelLine(Label.parse(labelText, schema));
		ret.startTime = start;
		ret.endTime = end;
		ret.state = state;
		ret.remaining = rest;
		return ret;
	}

	public Label getLabel() { return label; }
	public void setLabel(Label l) { label = l; }
	public int getState() { return state; }
	public void setState(int s) { state = s; }
	public boolean hasSegment() { return startTime >= 0; }
	public long getStartTime() { return startTime; }
	public long getEndTime() { return endTime; }
	public void setSegment(long start, long end) {
		if (end < start)
			throw new IllegalArgumentException("Segment ends ("+end+") before it starts ("+start+")");
		startTime = start;
		endTime = end;
	}
	public String[] getRemaining() { return remaining; }

	public String toString(LabelType type, boolean keepRemaining) {
		StringBuilder sb = new StringBuilder();
		if (hasSegment())
			sb.append(startTime).append(' ').append(endTime).append(' ');
		if (type == LabelType.FULL_CONTEXT)
			sb.append(label.toString());
		else
			sb.append(label.getCentralPhone());
		if (state > 0)
			sb.append('[').append(state).append(']');
		if (keepRemaining && remaining != null)
			for (String r : remaining)
				sb.append(' ').append(r);
		return sb.toString();
	}

	public String toString() {
		return toString(LabelType.FULL_CONTEXT, true);
	}
}
