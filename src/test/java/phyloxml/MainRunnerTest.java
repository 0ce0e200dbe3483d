package phyloxml;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainRunnerTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void testNewick2phyloxml() throws Exception {
		File in = tmp.newFile("apes.tre");
		FileUtils.writeStringToFile(in, "((human:0.1,chimp:0.2)hc:0.3,gorilla:0.5)root;\n", StandardCharsets.UTF_8);
		File out = new File(tmp.getRoot(), "apes.xml");

		assertEquals(0, MainRunner.run(new String[] {"newick2phyloxml", in.getPath(), out.getPath()}));
		String doc = FileUtils.readFileToString(out, StandardCharsets.UTF_8);
		assertTrue(doc.startsWith("<phyloxml "));
		assertTrue(doc.contains("<clade branch_length=\"0.1\">\n        <name>human</name>"));
	}

	@Test
	public void testDefaultOutputName() throws Exception {
		File in = tmp.newFile("pair.tre");
		FileUtils.writeStringToFile(in, "(a,b);", StandardCharsets.UTF_8);
		assertEquals(0, MainRunner.run(new String[] {"newick2phyloxml", in.getPath()}));
		assertTrue(new File(in.getPath() + ".xml").exists());
	}

	@Test
	public void testJson2phyloxml() throws Exception {
		File in = tmp.newFile("tree.json");
		FileUtils.writeStringToFile(in, "{\"parents\": [-1, 0],"
				+ " \"vertexData\": [{\"name\": \"phylogeny.property.size\", \"type\": \"int\", \"values\": [2, 0]}]}",
				StandardCharsets.UTF_8);
		File out = new File(tmp.getRoot(), "tree.xml");
		assertEquals(0, MainRunner.run(new String[] {"json2phyloxml", in.getPath(), out.getPath()}));
		assertTrue(FileUtils.readFileToString(out, StandardCharsets.UTF_8)
				.contains("<property datatype=\"xsd:integer\" ref=\"VTK:size\" applies_to=\"clade\">2</property>"));
	}

	@Test
	public void testBadInput() throws Exception {
		File in = tmp.newFile("broken.tre");
		FileUtils.writeStringToFile(in, "((a,b);", StandardCharsets.UTF_8);
		assertEquals(1, MainRunner.run(new String[] {"newick2phyloxml", in.getPath()}));
	}

	@Test
	public void testMissingFile() {
		assertEquals(1, MainRunner.run(new String[] {"json2phyloxml", new File(tmp.getRoot(), "nope.json").getPath()}));
	}

	@Test
	public void testUsage() {
		assertEquals(1, MainRunner.run(new String[0]));
		assertEquals(0, MainRunner.run(new String[] {"help"}));
		assertEquals(1, MainRunner.run(new String[] {"newick2phyloxml"}));
		assertEquals(2, MainRunner.run(new String[] {"frobnicate"}));
	}
}
