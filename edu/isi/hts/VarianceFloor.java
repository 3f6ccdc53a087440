package edu.isi.hts;

/** a named per-dimension variance floor (~v) */
public class VarianceFloor {
	private final String name;
	private final double[] variance;

	public VarianceFloor(String name, double[] variance) {
		this.name = name;
		this.variance = variance;
	}

	public String getName() { return name; }
	public double[] getVariance() { return variance; }
	public int getLength() { return variance.length; }
}
