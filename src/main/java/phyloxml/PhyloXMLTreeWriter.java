package phyloxml;

import arbor.tree.AttributeArray;
import arbor.tree.AttributedTree;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import phyloxml.constants.ArrayNames;
import phyloxml.constants.PhyloXMLAttribute;
import phyloxml.constants.PhyloXMLElement;
import phyloxml.exceptions.OutputWriteException;
import phyloxml.xml.XMLDataElement;

/**
 * Writes an AttributedTree as a phyloXML 1.10 document.
 *
 * Which arrays become which phyloXML constructs:
 * <ul>
 * <li>the edge array named by edgeWeightArrayName ("weight") gives each clade its branch_length</li>
 * <li>the vertex array named by nodeNameArrayName ("node name") gives each clade its name</li>
 * <li>vertex arrays "phylogeny.name", "phylogeny.description" and "phylogeny.confidence" give the
 *		phylogeny its name, description and confidence (value at index 0)</li>
 * <li>vertex arrays named "phylogeny.property.*" become properties of the phylogeny</li>
 * <li>vertex arrays "confidence" and "color" (3 numeric components) become clade confidence and
 *		color elements</li>
 * <li>every other vertex array becomes one property element per clade</li>
 * </ul>
 * No array is written twice. Edge arrays other than the weight array are not written.
 *
 * The writer only holds configuration; every call to write runs an independent pass.
 */
public class PhyloXMLTreeWriter {

	static Logger _LOG = Logger.getLogger(PhyloXMLTreeWriter.class);

	public static final String PHYLOXML_VERSION = "1.10";
	public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
	public static final String PHYLOXML_NAMESPACE = "http://www.phyloxml.org";
	public static final String SCHEMA_LOCATION = PHYLOXML_NAMESPACE + " http://www.phyloxml.org/"
			+ PHYLOXML_VERSION + "/phyloxml.xsd";

	private String edgeWeightArrayName;
	private String nodeNameArrayName;

	public PhyloXMLTreeWriter() {
		this.edgeWeightArrayName = ArrayNames.DEFAULT_EDGE_WEIGHT_ARRAY;
		this.nodeNameArrayName = ArrayNames.DEFAULT_NODE_NAME_ARRAY;
	}

	public String getEdgeWeightArrayName() {return this.edgeWeightArrayName;}

	public void setEdgeWeightArrayName(String name) {this.edgeWeightArrayName = name;}

	public String getNodeNameArrayName() {return this.nodeNameArrayName;}

	public void setNodeNameArrayName(String name) {this.nodeNameArrayName = name;}

	public String getDefaultFileExtension() {return "xml";}

	/**
	 * Writes `tree` to `out`. The writer is flushed but not closed.
	 * @throws OutputWriteException if `out` fails at any point; output written so far is left as is
	 */
	public void write(AttributedTree tree, Writer out) throws OutputWriteException {
		if (tree == null || !tree.hasRoot()) {
			throw new IllegalArgumentException("cannot write a tree without a root");
		}
		AttributeArray edgeWeightArray = tree.getEdgeData().getArray(this.edgeWeightArrayName);
		AttributeArray nodeNameArray = tree.getVertexData().getArray(this.nodeNameArrayName);
		if (edgeWeightArray == null) {
			_LOG.debug("no edge array \"" + this.edgeWeightArrayName + "\"; clades get no branch_length");
		}
		if (nodeNameArray == null) {
			_LOG.debug("no vertex array \"" + this.nodeNameArrayName + "\"; clades get no name");
		}
		WritePass pass = new WritePass(tree, edgeWeightArray, nodeNameArray);

		startFile(out);

		XMLDataElement rootElement = new XMLDataElement(PhyloXMLElement.PHYLOGENY.elementName);
		rootElement.setAttribute(PhyloXMLAttribute.ROOTED.attributeName, "true");

		// optional elements for the entire tree
		writeTreeLevelElement(pass, rootElement, PhyloXMLElement.NAME, null);
		writeTreeLevelElement(pass, rootElement, PhyloXMLElement.DESCRIPTION, null);
		writeTreeLevelElement(pass, rootElement, PhyloXMLElement.CONFIDENCE, PhyloXMLAttribute.TYPE);
		writeTreeLevelProperties(pass, rootElement);

		int clades = new CladeWriter(pass).writeClade(tree.getRoot(), rootElement);

		try {
			rootElement.printXML(out, 0);
		} catch (IOException ioe) {
			throw new OutputWriteException("writing the phylogeny element", ioe);
		}

		endFile(out);
		_LOG.debug("wrote " + clades + " clades; " + pass.getTracker().size() + " arrays written structurally or at tree level");
	}

	/**
	 * Writes `tree` to `file` as UTF-8, creating parent directories as needed.
	 */
	public void write(AttributedTree tree, File file) throws OutputWriteException {
		Writer out = null;
		try {
			out = new BufferedWriter(new OutputStreamWriter(FileUtils.openOutputStream(file), StandardCharsets.UTF_8));
		} catch (IOException ioe) {
			throw new OutputWriteException("opening " + file, ioe);
		}
		try {
			write(tree, out);
			out.close();
		} catch (IOException ioe) {
			throw new OutputWriteException("closing " + file, ioe);
		} finally {
			IOUtils.closeQuietly(out);
		}
		_LOG.info("wrote phyloXML to " + file);
	}

	/**
	 * @return the document for `tree` as a string
	 */
	public String writeToOutputString(AttributedTree tree) {
		StringWriter sw = new StringWriter();
		try {
			write(tree, sw);
		} catch (OutputWriteException owe) {
			throw new IllegalStateException("StringWriter rejected output", owe);
		}
		return sw.toString();
	}

	private void startFile(Writer out) throws OutputWriteException {
		try {
			out.write("<" + PhyloXMLElement.PHYLOXML.elementName + " xmlns:xsi=\"" + XSI_NAMESPACE + "\""
					+ " xmlns=\"" + PHYLOXML_NAMESPACE + "\" xsi:schemaLocation=\"" + SCHEMA_LOCATION + "\">\n");
			out.flush();
		} catch (IOException ioe) {
			throw new OutputWriteException("writing the phyloxml start tag", ioe);
		}
	}

	private void endFile(Writer out) throws OutputWriteException {
		try {
			out.write("</" + PhyloXMLElement.PHYLOXML.elementName + ">\n");
			out.flush();
		} catch (IOException ioe) {
			throw new OutputWriteException("writing the phyloxml end tag", ioe);
		}
	}

	/**
	 * Writes the tree level element `element` from the vertex array "phylogeny." + element name, if
	 *	there is one. `attribute`, when not null, is copied from the array information of the same name.
	 */
	private void writeTreeLevelElement(WritePass pass, XMLDataElement rootElement, PhyloXMLElement element,
			PhyloXMLAttribute attribute) {
		String arrayName = ArrayNames.TREE_LEVEL_PREFIX + element.elementName;
		AttributeArray array = pass.getTree().getVertexData().getArray(arrayName);
		if (array == null) {
			return;
		}
		XMLDataElement e = new XMLDataElement(element.elementName);
		e.setCharacterData(array.getVariantValue(0).toString());
		if (attribute != null) {
			String attributeValue = array.getInformation(attribute.attributeName);
			if (StringUtils.isNotEmpty(attributeValue)) {
				e.setAttribute(attribute.attributeName, attributeValue);
			}
		}
		rootElement.addNestedElement(e);
		pass.getTracker().mark(arrayName);
	}

	private void writeTreeLevelProperties(WritePass pass, XMLDataElement rootElement) {
		for (AttributeArray array : pass.getTree().getVertexData()) {
			if (array.getName().startsWith(ArrayNames.TREE_PROPERTY_PREFIX)) {
				PropertyDescriptor property = pass.getResolver().resolveTreeLevel(array, pass.getTracker());
				rootElement.addNestedElement(property.toElement());
			}
		}
	}

	public void printSelf(PrintStream os) {
		os.println(getClass().getSimpleName() + ":");
		os.println("  EdgeWeightArrayName: " + this.edgeWeightArrayName);
		os.println("  NodeNameArrayName: " + this.nodeNameArrayName);
	}
}
