package edu.isi.wfst;
/** for errors in the text format of weights */

public class DataFormatException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public DataFormatException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public DataFormatException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public DataFormatException(String message, Throwable cause) { super(message, cause); }
}
