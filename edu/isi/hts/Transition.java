package edu.isi.hts;

/** square state transition matrix (~t), entry and exit states included */
public class Transition {
	private final String name;
	private final double[][] matrix;

	public Transition(String name, double[][] matrix) throws DimensionMismatchException {
		for (double[] row : matrix)
			if (row.length != matrix.length)
				throw new DimensionMismatchException("Transition "+name+" has a row of "+row.length+
													 " values in a "+matrix.length+" state matrix");
		this.name = name;
		this.matrix = matrix;
	}

	/** null when embedded in a model */
	public String getName() { return name; }
	public double[][] getMatrix() { return matrix; }
	public int getSize() { return matrix.length; }
}
