package edu.isi.hts;
/** for vectors whose dimensions do not agree */
public class DimensionMismatchException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public DimensionMismatchException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public DimensionMismatchException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public DimensionMismatchException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public DimensionMismatchException(Throwable cause) { super(cause); } 
}
