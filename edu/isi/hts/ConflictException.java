package edu.isi.hts;
/** for a name defined twice with different content */
public class ConflictException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public ConflictException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public ConflictException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ConflictException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public ConflictException(Throwable cause) { super(cause); } 
}
