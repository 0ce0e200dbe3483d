package phyloxml;

import arbor.tree.AttributeArray;
import arbor.tree.AttributedTree;
import arbor.tree.Variant;

import org.apache.commons.lang3.StringUtils;

import phyloxml.constants.ArrayNames;
import phyloxml.constants.PhyloXMLAttribute;
import phyloxml.constants.PhyloXMLElement;
import phyloxml.xml.XMLDataElement;

/**
 * One structural part of a clade element, written from an attribute array whose name (or role)
 *	gives it a dedicated phyloXML representation. CladeWriter applies its rules to every vertex, in
 *	order, before writing the remaining arrays as properties.
 */
public interface CladeRule {

	/**
	 * @return true if the pass has the data this rule needs
	 */
	boolean appliesTo(WritePass pass);

	/**
	 * Adds this rule's attribute or element for `vertex` to `cladeElement` and marks the source
	 *	array in the pass tracker. Only called when appliesTo(pass) is true.
	 */
	void write(WritePass pass, int vertex, XMLDataElement cladeElement);

	/**
	 * branch_length attribute, from the edge into the vertex.
	 */
	public static class BranchLength implements CladeRule {

		@Override
		public boolean appliesTo(WritePass pass) {
			return pass.getEdgeWeightArray() != null;
		}

		@Override
		public void write(WritePass pass, int vertex, XMLDataElement cladeElement) {
			AttributedTree tree = pass.getTree();
			AttributeArray weights = pass.getEdgeWeightArray();
			int parent = tree.getParent(vertex);
			if (parent != AttributedTree.NONE) {
				int edge = tree.getEdgeId(parent, vertex);
				if (edge != AttributedTree.NONE) {
					double weight = weights.getVariantValue(edge).toDouble();
					cladeElement.setDoubleAttribute(PhyloXMLAttribute.BRANCH_LENGTH.attributeName, weight);
				}
			}
			pass.getTracker().mark(weights.getName());
		}
	}

	/**
	 * name element, omitted when the vertex has an empty name.
	 */
	public static class Name implements CladeRule {

		@Override
		public boolean appliesTo(WritePass pass) {
			return pass.getNodeNameArray() != null;
		}

		@Override
		public void write(WritePass pass, int vertex, XMLDataElement cladeElement) {
			AttributeArray names = pass.getNodeNameArray();
			String name = names.getVariantValue(vertex).toString();
			if (!name.isEmpty()) {
				XMLDataElement nameElement = new XMLDataElement(PhyloXMLElement.NAME.elementName);
				nameElement.setCharacterData(name);
				cladeElement.addNestedElement(nameElement);
			}
			pass.getTracker().mark(names.getName());
		}
	}

	/**
	 * confidence element from the "confidence" vertex array, typed by its `type` information.
	 */
	public static class Confidence implements CladeRule {

		@Override
		public boolean appliesTo(WritePass pass) {
			return pass.getTree().getVertexData().getArray(ArrayNames.CONFIDENCE) != null;
		}

		@Override
		public void write(WritePass pass, int vertex, XMLDataElement cladeElement) {
			AttributeArray confidenceArray = pass.getTree().getVertexData().getArray(ArrayNames.CONFIDENCE);
			String confidence = confidenceArray.getVariantValue(vertex).toString();
			if (!confidence.isEmpty()) {
				XMLDataElement confidenceElement = new XMLDataElement(PhyloXMLElement.CONFIDENCE.elementName);
				String type = confidenceArray.getInformation(ArrayNames.INFO_TYPE);
				if (StringUtils.isNotEmpty(type)) {
					confidenceElement.setAttribute(PhyloXMLAttribute.TYPE.attributeName, type);
				}
				confidenceElement.setCharacterData(confidence);
				cladeElement.addNestedElement(confidenceElement);
			}
			pass.getTracker().mark(ArrayNames.CONFIDENCE);
		}
	}

	/**
	 * color element from a numeric, three component "color" vertex array. A "color" array of any
	 *	other shape is left alone (and so ends up as a property).
	 */
	public static class Color implements CladeRule {

		@Override
		public boolean appliesTo(WritePass pass) {
			AttributeArray colorArray = pass.getTree().getVertexData().getArray(ArrayNames.COLOR);
			return colorArray != null && colorArray.getNumberOfComponents() == 3 && colorArray.getKind().isNumeric();
		}

		@Override
		public void write(WritePass pass, int vertex, XMLDataElement cladeElement) {
			AttributeArray colorArray = pass.getTree().getVertexData().getArray(ArrayNames.COLOR);
			XMLDataElement colorElement = new XMLDataElement(PhyloXMLElement.COLOR.elementName);
			colorElement.addNestedElement(component(PhyloXMLElement.RED, colorArray.getComponent(vertex, 0)));
			colorElement.addNestedElement(component(PhyloXMLElement.GREEN, colorArray.getComponent(vertex, 1)));
			colorElement.addNestedElement(component(PhyloXMLElement.BLUE, colorArray.getComponent(vertex, 2)));
			cladeElement.addNestedElement(colorElement);
			pass.getTracker().mark(ArrayNames.COLOR);
		}

		private static XMLDataElement component(PhyloXMLElement which, Variant value) {
			XMLDataElement e = new XMLDataElement(which.elementName);
			e.setCharacterData(value.toString());
			return e;
		}
	}
}
