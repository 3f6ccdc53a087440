package edu.isi.hts;
/** for trees and schemas that would be left in an illegal shape */
public class StructuralInvariantException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public StructuralInvariantException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public StructuralInvariantException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public StructuralInvariantException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public StructuralInvariantException(Throwable cause) { super(cause); } 
}
