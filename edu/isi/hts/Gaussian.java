package edu.isi.hts;

/**
 * One weighted diagonal Gaussian. Mean and variance always have the same
 * length.
 */
public class Gaussian {
	private double weight;
	private double globalConstant;
	private double[] mean;
	private double[] variance;

	public Gaussian(double weight, double[] mean, double[] variance) throws DimensionMismatchException {
		if (mean.length != variance.length)
			throw new DimensionMismatchException("Gaussian mean has "+mean.length+" dimensions but variance has "+
												 variance.length);
		this.weight = weight;
		this.mean = mean;
		this.variance = variance;
	}

	public Gaussian(double weight, double[] mean, double[] variance, double globalConstant)
		throws DimensionMismatchException {
		this(weight, mean, variance);
		this.globalConstant = globalConstant;
	}

	public double getWeight() { return weight; }
	public void setWeight(double w) { weight = w; }
	public double getGlobalConstant() { return globalConstant; }
	public void setGlobalConstant(double g) { globalConstant = g; }
	public double[] getMean() { return mean; }
	public double[] getVariance() { return variance; }
	public int getLength() { return mean.length; }

	/** true if every mean and variance value is 0; the unvoiced half of an MSD stream */
	public boolean isZero() {
		for (int i = 0; i < mean.length; i++)
			if (mean[i] != 0 || variance[i] != 0)
				return false;
		return true;
	}

	/** the first keep dimensions, or all of them if there are fewer */
	public Gaussian prune(int keep) {
		int n = Math.min(keep, mean.length);
		double[] m = new double[n];
		double[] v = new double[n];
		System.arraycopy(mean, 0, m, 0, n);
		System.arraycopy(variance, 0, v, 0, n);
		Gaussian ret = new Gaussian();
		ret.weight = weight;
		ret.globalConstant = globalConstant;
		ret.mean = m;
		ret.variance = v;
		return ret;
	}

	private Gaussian() {
	}

	/** clamp each variance to at least the floor */
	public void floorVariance(double[] floor) throws DimensionMismatchException {
		if (floor.length != variance.length)
			throw new DimensionMismatchException("Variance floor has "+floor.length+" dimensions but Gaussian has "+
												 variance.length);
		for (int i = 0; i < variance.length; i++)
			if (variance[i] < floor[i])
				variance[i] = floor[i];
	}

	/** weight (unless unknown), lengths and values within tolerance */
	public boolean approximatelyEquals(Gaussian other, boolean compareData) {
		if (!Double.isNaN(weight) && !Double.isNaN(other.weight) && (float)weight != (float)other.weight)
			return false;
		return approximatelyEquals(mean, other.mean, compareData) &&
			approximatelyEquals(variance, other.variance, compareData);
	}

	static final double TOLERANCE = 0.00001;

	static boolean approximatelyEquals(double[] a, double[] b, boolean compareData) {
		if (a.length != b.length)
			return false;
		if (!compareData)
			return true;
		for (int i = 0; i < a.length; i++) {
			double d = Math.abs(a[i]-b[i]);
			if (d > Math.abs(b[i])*TOLERANCE && d > TOLERANCE)
				return false;
		}
		return true;
	}
}
