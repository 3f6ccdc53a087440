package edu.isi.hts;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** line reader that can give back the last line read, once */
public class RewindableReader implements Closeable {
	private final BufferedReader reader;
	private String cachedLine;
	private boolean rewound = false;
	private int lineNumber = 0;

	public RewindableReader(BufferedReader reader) {
		this.reader = reader;
	}

	public String readLine() throws IOException {
		if (!rewound) {
			cachedLine = reader.readLine();
			if (cachedLine != null)
				lineNumber++;
		}
		rewound = false;
		return cachedLine;
	}

	public String peekLine() throws IOException {
		String line = readLine();
		rewindLine();
		return line;
	}

	/** hand the last line out again on the next read */
	public void rewindLine() {
		if (rewound)
			throw new IllegalStateException("Only a single line can be rewound");
		rewound = true;
	}

	/**
	 * Lines up to the first one starting with a stopper. The stopping line is
	 * returned too if inclusive; otherwise it is left for the next read.
	 */
	public List<String> readLines(String[] stoppers, boolean inclusive) throws IOException {
		List<String> ret = new ArrayList<String>();
		String line;
		while ((line = readLine()) != null) {
			boolean stop = false;
			for (String s : stoppers)
				if (line.startsWith(s))
					stop = true;
			if (stop) {
				if (inclusive)
					ret.add(line);
				else
					rewindLine();
				break;
			}
			ret.add(line);
		}
		return ret;
	}

	/** number of the last line read */
	public int getLineNumber() {
		return lineNumber;
	}

	public void close() throws IOException {
		reader.close();
	}
}
