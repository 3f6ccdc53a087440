package edu.isi.hts;
/** for names (macros, questions, tree nodes) that are used but never defined */
public class UndefinedReferenceException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public UndefinedReferenceException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public UndefinedReferenceException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public UndefinedReferenceException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public UndefinedReferenceException(Throwable cause) { super(cause); } 
}
