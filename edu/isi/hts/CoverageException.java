package edu.isi.hts;
/** for question sets that leave part of a phone inventory uncovered */
public class CoverageException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public CoverageException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public CoverageException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public CoverageException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public CoverageException(Throwable cause) { super(cause); } 
}
