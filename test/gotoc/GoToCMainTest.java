package gotoc;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class GoToCMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private ByteArrayOutputStream stdout;
	private ByteArrayOutputStream stderr;

	@Before
	public void setup() {
		stdout = new ByteArrayOutputStream();
		stderr = new ByteArrayOutputStream();
	}

	private boolean run(String... args) {
		return new GoToCMain(args,
				new PrintStream(stdout, true),
				new PrintStream(stderr, true)).run();
	}

	private String expected(String name) throws IOException {
		return FileUtils.readFileToString(new File("./examples/" + name + ".c"), StandardCharsets.UTF_8);
	}

	@Test
	public void testWritesToStandardOutput() throws IOException {
		assertTrue(run("-q", "./examples/add.json"));
		assertEquals(expected("add"), new String(stdout.toByteArray(), StandardCharsets.UTF_8));
	}

	@Test
	public void testWritesToOutputFile() throws IOException {
		File out = new File(folder.getRoot(), "loops.c");
		assertTrue(run("-q", "-o", out.getPath(), "./examples/loops.json"));
		assertEquals(expected("loops"), FileUtils.readFileToString(out, StandardCharsets.UTF_8));
		assertEquals(0, stdout.size());
	}

	@Test
	public void testDumpGoesToStandardError() {
		assertTrue(run("-q", "-d", "./examples/add.json"));
		String dumped = new String(stderr.toByteArray(), StandardCharsets.UTF_8);
		assertThat(dumped, startsWith("GoModule main\n"));
		assertThat(dumped, containsString("GoFunctionDeclaration Add"));
	}

	@Test
	public void testVersion() {
		assertTrue(run("--version"));
		assertThat(new String(stdout.toByteArray(), StandardCharsets.UTF_8), containsString(GoToCOptions.VERSION));
	}

	@Test
	public void testMissingArgumentFails() {
		assertFalse(run());
		assertEquals(0, stdout.size());
		assertThat(new String(stderr.toByteArray(), StandardCharsets.UTF_8), containsString("ast.json"));
	}

	@Test
	public void testMissingInputFileFails() {
		assertFalse(run("-q", new File(folder.getRoot(), "absent.json").getPath()));
	}

	@Test
	public void testMalformedInputFails() throws IOException {
		File input = folder.newFile("broken.json");
		FileUtils.writeStringToFile(input, "{\"decls\": [{\"kind\": \"GoStmt\"}]}", StandardCharsets.UTF_8);
		assertFalse(run("-q", input.getPath()));
		assertEquals(0, stdout.size());
	}

	@Test
	public void testUnsupportedShapeWritesNothing() throws IOException {
		File input = folder.newFile("pair.json");
		FileUtils.writeStringToFile(input, "{\"decls\": ["
				+ "{\"kind\": \"ImportDecl\", \"path\": \"\\\"os\\\"\"},"
				+ "{\"kind\": \"FuncDecl\", \"name\": \"pair\","
				+ "\"results\": [{\"type\": {\"kind\": \"Ident\", \"name\": \"int\"}}, {\"type\": {\"kind\": \"Ident\", \"name\": \"int\"}}],"
				+ "\"body\": {\"kind\": \"BlockStmt\"}}]}", StandardCharsets.UTF_8);
		File out = new File(folder.getRoot(), "pair.c");
		assertFalse(run("-q", "-o", out.getPath(), input.getPath()));
		assertFalse(out.exists());
		assertEquals(0, stdout.size());
	}

}
