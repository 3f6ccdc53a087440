package edu.isi.hts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** one emitting state: a stream per feature, embedded or referenced */
public class HmmState {
	private final List<Macro<HmmStream>> streams = new ArrayList<Macro<HmmStream>>();

	public void addStream(Macro<HmmStream> stream) {
		streams.add(stream);
	}

	public List<Macro<HmmStream>> getStreams() {
		return Collections.unmodifiableList(streams);
	}
}
