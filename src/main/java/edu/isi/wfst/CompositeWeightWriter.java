package edu.isi.wfst;

/**
 * Writes composite weights (weights built out of other weights) as text:
 * an optional open marker, the elements joined by the separator, and an
 * optional close marker. The separator and markers are process-wide
 * settings shared with {@link CompositeWeightReader}.
 */
public class CompositeWeightWriter {

	private static char separator = ',';
	private static String parentheses = "()";

	public static void setSeparator(char c) {
		if (parentheses.indexOf(c) >= 0)
			throw new IllegalArgumentException("Separator "+c+" collides with parentheses \""+parentheses+"\"");
		separator = c;
	}
	public static char getSeparator() { return separator; }

	/**
	 * @param p either empty, for no markers, or exactly two characters: the open and close markers
	 */
	public static void setParentheses(String p) {
		if (p.length() != 0 && p.length() != 2)
			throw new IllegalArgumentException("Parentheses must be empty or two characters, got \""+p+"\"");
		if (p.indexOf(separator) >= 0)
			throw new IllegalArgumentException("Parentheses \""+p+"\" collide with separator "+separator);
		parentheses = p;
	}
	public static String getParentheses() { return parentheses; }

	private final StringBuilder buf;
	private int elements = 0;

	public CompositeWeightWriter(StringBuilder buf) {
		this.buf = buf;
	}

	public void writeBegin() {
		if (parentheses.length() == 2)
			buf.append(parentheses.charAt(0));
	}

	public void writeElement(Object o) {
		if (elements > 0)
			buf.append(separator);
		buf.append(o);
		elements++;
	}

	public void writeEnd() {
		if (parentheses.length() == 2)
			buf.append(parentheses.charAt(1));
	}
}
