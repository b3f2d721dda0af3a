package edu.isi.wfst;
/** for errors in the tool's options, like unknown semirings or 
    unreadable plugin directories */
public class ConfigureException extends Exception {
    /**      Constructs a new exception with the specified detail message. */
    public ConfigureException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ConfigureException(String message, Throwable cause) { super(message, cause); }
}
