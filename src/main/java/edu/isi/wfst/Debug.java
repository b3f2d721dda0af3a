package edu.isi.wfst;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
// logging for the library and the tool. everything goes to stderr
public class Debug {

	static String encoding = "utf-8";
	public static void setEncoding(String s) {
		encoding = s;
		initializeStream();
	}

	private static OutputStreamWriter w=null;
	private static synchronized void initializeStream() {
		try {
			w = new OutputStreamWriter(System.err, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(System.err);
		}
	}

	// stuff we always print to stderr
	public static void prettyDebug(String s) {
		write(s+"\n");
	}

	// problems the caller recovers from, e.g. a registry miss. tagged with the reporting method
	public static void error(String s) {
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		write("ERROR: "+caller.getClassName()+":"+caller.getMethodName()+" : "+s+"\n");
	}

	// true debugging stuff
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		write(caller.getClassName()+":"+caller.getMethodName()+" : "+s+"\n");
	}

	private static synchronized void write(String s) {
		if (w == null)
			initializeStream();
		try {
			w.write(s);
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}
}
