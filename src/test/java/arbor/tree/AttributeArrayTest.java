package arbor.tree;

import static org.junit.Assert.*;

import org.junit.Test;

public class AttributeArrayTest {

	@Test
	public void testSingleComponentValues() {
		AttributeArray arr = AttributeArray.ofDoubles("weight", 1.5, 2.0);
		assertEquals(2, arr.getNumberOfTuples());
		assertEquals("1.5", arr.getVariantValue(0).toString());
		assertEquals("2.0", arr.getVariantValue(1).toString());
		assertEquals(ValueKind.DOUBLE, arr.getVariantValue(1).getKind());
	}

	@Test
	public void testOutOfRangeIsInvalid() {
		AttributeArray arr = AttributeArray.ofStrings("node name", "x");
		Variant v = arr.getVariantValue(5);
		assertFalse(v.isValid());
		assertEquals("", v.toString());
		assertEquals(Variant.INVALID, arr.getVariantValue(-1));
	}

	@Test
	public void testTuples() {
		AttributeArray color = new AttributeArray("color", ValueKind.UNSIGNED_CHAR, 3);
		color.insertNextTuple(255, 0, 0);
		color.insertNextTuple(0, 128, 255);
		assertEquals(2, color.getNumberOfTuples());
		assertEquals("128", color.getComponent(1, 1).toString());
		assertEquals("255", color.getVariantValue(0).toString());
		assertFalse(color.getComponent(0, 3).isValid());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWrongTupleWidth() {
		new AttributeArray("color", ValueKind.UNSIGNED_CHAR, 3).insertNextTuple(1, 2);
	}

	@Test(expected = IllegalStateException.class)
	public void testInsertNextValueOnMultiComponent() {
		new AttributeArray("color", ValueKind.UNSIGNED_CHAR, 3).insertNextValue(1);
	}

	@Test
	public void testInformation() {
		AttributeArray arr = AttributeArray.ofInts("property.size", 3);
		assertNull(arr.getInformation("unit"));
		arr.setInformation("unit", "mm");
		assertEquals("mm", arr.getInformation("unit"));
		assertTrue(arr.getInformationKeys().contains("unit"));
	}

	@Test
	public void testVariantConversions() {
		assertEquals("42", Variant.of(ValueKind.INT, "42").toString());
		assertEquals("true", Variant.of(ValueKind.BIT, 1).toString());
		assertEquals("18446744073709551615", Variant.of(ValueKind.UNSIGNED_LONG_LONG, "18446744073709551615").toString());
		assertEquals(1.8446744073709552E19, Variant.of(ValueKind.ID_TYPE, -1L).toDouble(), 1e4);
		assertEquals(0.0, Variant.of(ValueKind.STRING, "abc").toDouble(), 0.0);
		assertEquals(3.25, Variant.of(ValueKind.STRING, "3.25").toDouble(), 0.0);
		assertEquals("2.5", Variant.of(ValueKind.FLOAT, 2.5).toString());
		assertEquals(Variant.INVALID, Variant.of(ValueKind.INT, null));
	}

	@Test(expected = NumberFormatException.class)
	public void testBadNumberString() {
		Variant.of(ValueKind.INT, "forty two");
	}

	@Test
	public void testNarrowKindBounds() {
		ValueKind[] kinds = {ValueKind.CHAR, ValueKind.SIGNED_CHAR, ValueKind.UNSIGNED_CHAR, ValueKind.SHORT,
				ValueKind.UNSIGNED_SHORT, ValueKind.INT, ValueKind.UNSIGNED_INT};
		long[] mins = {-128, -128, 0, -32768, 0, Integer.MIN_VALUE, 0};
		long[] maxs = {127, 127, 255, 32767, 65535, Integer.MAX_VALUE, 4294967295L};
		for (int i = 0; i < kinds.length; i++) {
			assertEquals(Long.toString(mins[i]), Variant.of(kinds[i], mins[i]).toString());
			assertEquals(Long.toString(maxs[i]), Variant.of(kinds[i], Long.toString(maxs[i])).toString());
			assertOutOfRange(kinds[i], mins[i] - 1);
			assertOutOfRange(kinds[i], maxs[i] + 1);
		}
		assertEquals(Long.toString(Long.MIN_VALUE), Variant.of(ValueKind.LONG_LONG, Long.MIN_VALUE).toString());
	}

	private static void assertOutOfRange(ValueKind kind, long v) {
		try {
			Variant.of(kind, v);
			fail("expected NumberFormatException for " + v + " as " + kind);
		} catch (NumberFormatException nfe) {
			assertTrue(nfe.getMessage().contains(kind.typeName));
		}
	}

	@Test(expected = NumberFormatException.class)
	public void testOutOfRangeValueRejectedByArray() {
		new AttributeArray("b", ValueKind.UNSIGNED_CHAR).insertNextValue(300);
	}

	@Test
	public void testKindLookup() {
		assertEquals(ValueKind.UNSIGNED_INT, ValueKind.forTypeName("unsigned int"));
		assertNull(ValueKind.forTypeName("quaternion"));
		assertTrue(ValueKind.ID_TYPE.isIntegral());
		assertTrue(ValueKind.FLOAT.isNumeric());
		assertFalse(ValueKind.STRING.isNumeric());
	}
}
