package edu.isi.hts;

/** comparison a question makes between a feature value and its value set */
public enum QuestionOperator {
	EQUAL("=="),
	BELONG("_"),
	LESS("<"),
	LESS_EQUAL("<="),
	GREATER(">"),
	GREATER_EQUAL(">=");

	private final String symbol;
	private QuestionOperator(String symbol) {
		this.symbol = symbol;
	}

	/** the text placed between feature name and value set name */
	public String getSymbol() {
		return symbol;
	}

	public static QuestionOperator fromSymbol(String s) throws DataFormatException {
		for (QuestionOperator op : values())
			if (op.symbol.equals(s))
				return op;
		throw new DataFormatException("Unknown question operator "+s);
	}
}
