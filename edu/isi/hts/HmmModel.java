package edu.isi.hts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** a model (~h): its emitting states and an optional transition */
public class HmmModel {
	private final String name;
	private final List<HmmState> states = new ArrayList<HmmState>();
	private Macro<Transition> transition;

	public HmmModel(String name) {
		this.name = name;
	}

	public String getName() { return name; }

	public void addState(HmmState state) {
		states.add(state);
	}

	public List<HmmState> getStates() {
		return Collections.unmodifiableList(states);
	}

	/** null if the model names no transition */
	public Macro<Transition> getTransition() { return transition; }
	public void setTransition(Macro<Transition> t) { transition = t; }

	/**
	 * Clamp the variances of every Gaussian used by this model to floor.
	 * Empty Gaussians (the unvoiced half of an MSD stream) are left alone.
	 */
	public void correctVariance(double[] floor, Map<String, HmmStream> globalStreams)
		throws DimensionMismatchException, UndefinedReferenceException {
		for (HmmState state : states)
			for (Macro<HmmStream> m : state.getStreams())
				for (Gaussian g : m.resolve(globalStreams).getGaussians())
					if (g.getLength() > 0)
						g.floorVariance(floor);
	}
}
