package phyloxml.xml;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

import org.apache.commons.lang3.StringEscapeUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * An in-memory XML element: a name, attributes in insertion order, optional character data and an
 *	ordered list of nested elements. printXML writes the element and everything below it.
 */
@SuppressWarnings("deprecation")
public class XMLDataElement {

	private static final String INDENT = "  ";

	/** deeper elements are written with the indentation of this level */
	public static final int MAX_INDENT_LEVELS = 20;

	private final String name;
	private final LinkedHashMap<String, String> attributes;
	private String characterData;
	private final ArrayList<XMLDataElement> nested;

	public XMLDataElement(String name) {
		if (StringUtils.isEmpty(name)) {
			throw new IllegalArgumentException("element name may not be empty");
		}
		this.name = name;
		this.attributes = new LinkedHashMap<String, String>();
		this.characterData = null;
		this.nested = new ArrayList<XMLDataElement>();
	}

	public String getName() {return this.name;}

	/**
	 * Sets (or replaces) attribute `attrName`. Replacing keeps the original attribute position.
	 */
	public void setAttribute(String attrName, String value) {
		this.attributes.put(attrName, value == null ? "" : value);
	}

	public void setDoubleAttribute(String attrName, double value) {
		setAttribute(attrName, Double.toString(value));
	}

	/**
	 * @return the attribute value or null
	 */
	public String getAttribute(String attrName) {
		return this.attributes.get(attrName);
	}

	public Map<String, String> getAttributes() {
		return Collections.unmodifiableMap(this.attributes);
	}

	public void setCharacterData(String data) {
		this.characterData = data;
	}

	/**
	 * @return the character data or null if none was set
	 */
	public String getCharacterData() {return this.characterData;}

	public void addNestedElement(XMLDataElement element) {
		this.nested.add(element);
	}

	public List<XMLDataElement> getNestedElements() {
		return Collections.unmodifiableList(this.nested);
	}

	public int getNumberOfNestedElements() {return this.nested.size();}

	public XMLDataElement getNestedElement(int i) {return this.nested.get(i);}

	/**
	 * @return the first directly nested element named `elementName`, or null
	 */
	public XMLDataElement findNestedElementWithName(String elementName) {
		for (XMLDataElement e : this.nested) {
			if (e.getName().equals(elementName)) {
				return e;
			}
		}
		return null;
	}

	/**
	 * Writes this element with `indent` levels of indentation. Each element starts on its own line,
	 *	nested elements are indented one more level than their parent, up to MAX_INDENT_LEVELS.
	 *	The walk uses an explicit stack so arbitrarily deep documents can be printed.
	 */
	public void printXML(Writer out, int indent) throws IOException {
		Stack<PrintFrame> frames = new Stack<PrintFrame>();
		frames.push(new PrintFrame(this, indent, false));
		while (!frames.isEmpty()) {
			PrintFrame frame = frames.pop();
			XMLDataElement element = frame.element;
			String pad = padding(frame.depth);
			if (frame.closing) {
				out.write(pad);
				out.write("</");
				out.write(element.name);
				out.write(">\n");
				continue;
			}
			out.write(pad);
			out.write('<');
			out.write(element.name);
			for (Map.Entry<String, String> attr : element.attributes.entrySet()) {
				out.write(' ');
				out.write(attr.getKey());
				out.write("=\"");
				out.write(StringEscapeUtils.escapeXml10(attr.getValue()));
				out.write('"');
			}
			boolean hasData = StringUtils.isNotEmpty(element.characterData);
			if (element.nested.isEmpty() && !hasData) {
				out.write("/>\n");
				continue;
			}
			out.write('>');
			if (hasData) {
				out.write(StringEscapeUtils.escapeXml10(element.characterData));
			}
			if (element.nested.isEmpty()) {
				out.write("</");
				out.write(element.name);
				out.write(">\n");
				continue;
			}
			out.write('\n');
			frames.push(new PrintFrame(element, frame.depth, true));
			// reverse order so the first nested element is printed first
			for (int i = element.nested.size() - 1; i >= 0; i--) {
				frames.push(new PrintFrame(element.nested.get(i), frame.depth + 1, false));
			}
		}
	}

	static String padding(int depth) {
		return StringUtils.repeat(INDENT, Math.max(0, Math.min(depth, MAX_INDENT_LEVELS)));
	}

	private static final class PrintFrame {
		final XMLDataElement element;
		final int depth;
		final boolean closing;

		PrintFrame(XMLDataElement element, int depth, boolean closing) {
			this.element = element;
			this.depth = depth;
			this.closing = closing;
		}
	}
}
