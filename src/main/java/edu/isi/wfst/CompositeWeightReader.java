package edu.isi.wfst;

/**
 * Reads the format written by {@link CompositeWeightWriter}. Elements that are
 * themselves composite are returned whole, markers included, as long as the
 * markers are turned on.
 */
public class CompositeWeightReader {
	private final String s;
	private final char separator;
	private final char open;
	private final char close;
	private final boolean marked;
	private int pos;
	private int end;

	public CompositeWeightReader(String s) {
		this.s = s.trim();
		separator = CompositeWeightWriter.getSeparator();
		String p = CompositeWeightWriter.getParentheses();
		marked = p.length() == 2;
		open = marked ? p.charAt(0) : 0;
		close = marked ? p.charAt(1) : 0;
	}

	public void readBegin() throws DataFormatException {
		pos = 0;
		end = s.length();
		if (!marked)
			return;
		if (s.length() < 2 || s.charAt(0) != open)
			throw new DataFormatException("Expected "+open+" at start of composite weight \""+s+"\"");
		if (s.charAt(s.length()-1) != close)
			throw new DataFormatException("Expected "+close+" at end of composite weight \""+s+"\"");
		pos = 1;
		end = s.length()-1;
	}

	// true while there is something left to read
	public boolean hasMore() {
		return pos <= end && !(pos == end && pos == (marked ? 1 : 0));
	}

	// the next element. Consumes the separator after it, if any
	public String readElement() throws DataFormatException {
		if (!hasMore())
			throw new DataFormatException("Ran out of elements in composite weight \""+s+"\"");
		int depth = 0;
		int i = pos;
		for (; i < end; i++) {
			char c = s.charAt(i);
			if (marked && c == open)
				depth++;
			else if (marked && c == close) {
				if (--depth < 0)
					throw new DataFormatException("Unbalanced "+close+" in composite weight \""+s+"\"");
			}
			else if (c == separator && depth == 0)
				break;
		}
		if (depth != 0)
			throw new DataFormatException("Unbalanced "+open+" in composite weight \""+s+"\"");
		String elt = s.substring(pos, i).trim();
		// step over the separator; a trailing separator leaves an empty last element
		pos = i < end ? i+1 : end+1;
		return elt;
	}

	public void readEnd() throws DataFormatException {
		if (hasMore())
			throw new DataFormatException("Unread elements at end of composite weight \""+s+"\"");
	}
}
