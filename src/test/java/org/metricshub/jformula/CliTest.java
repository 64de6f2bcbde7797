package org.metricshub.jformula;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.jformula.frontend.ParserException;

public class CliTest {

	private static String[] runWithInput(String input, String... args) throws IOException {
		InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli.create(
				args,
				in,
				new PrintStream(out, true, StandardCharsets.UTF_8.name()),
				new PrintStream(err, true, StandardCharsets.UTF_8.name()));
		return out.toString(StandardCharsets.UTF_8.name()).split("\\R");
	}

	private static String[] run(String... args) throws IOException {
		return runWithInput("", args);
	}

	@Test
	public void testFormulaArgument() throws IOException {
		assertArrayEquals(new String[] { "1 + 2" }, run("=1+2"));
	}

	@Test
	public void testSeveralFormulas() throws IOException {
		assertArrayEquals(new String[] { "1", "pi" }, run("=1", "=PI()"));
	}

	@Test
	public void testFormulaStartingWithDash() throws IOException {
		assertArrayEquals(new String[] { "-eval_cell(\"A1\")" }, run("-A1"));
	}

	@Test
	public void testCurrentCell() throws IOException {
		assertArrayEquals(new String[] { "eval_cell(\"Sheet1!B1\")" }, run("-c", "Sheet1!A1", "=B1"));
	}

	@Test
	public void testStandardInput() throws IOException {
		assertArrayEquals(
				new String[] { "1", "xsum(eval_cell(\"A1\"))" },
				runWithInput("=1\n\n=SUM(A1)\n"));
		assertArrayEquals(new String[] { "2 ** 2" }, runWithInput("=2^2\n", "-"));
	}

	@Test
	public void testFunctionMapping() throws IOException {
		assertArrayEquals(new String[] { "mean(1)" }, run("-m", "average=mean", "=AVERAGE(1)"));
	}

	@Test
	public void testLookupNames() throws IOException {
		assertArrayEquals(
				new String[] { "cell(\"A1\") + cells(\"B1:B2\")" },
				run("--cell-lookup", "cell", "--range-lookup", "cells", "=A1+B1:B2"));
	}

	@Test
	public void testDumpPostfix() throws IOException {
		assertArrayEquals(
				new String[] { "OperandNode<1> OperandNode<2> OperatorNode<+>", "1 + 2" },
				run("--dump-postfix", "=1+2"));
	}

	@Test
	public void testDumpSyntaxTree() throws IOException {
		assertArrayEquals(
				new String[] { "OperatorNode<+>", " OperandNode<1>", " OperandNode<2>", "1 + 2" },
				run("--dump-syntax", "=1+2"));
	}

	@Test
	public void testDumpTokens() throws IOException {
		assertArrayEquals(
				new String[] { "'1' <OPERAND NUMBER>", "'+' <OP_IN>", "'2' <OPERAND NUMBER>", "1 + 2" },
				run("--dump-tokens", "=1+2"));
	}

	@Test
	public void testUsage() throws IOException {
		String[] lines = run("-h");
		assertEquals("Usage:", lines[0]);
		assertThrows(IllegalArgumentException.class, () -> run("-h", "=1"));
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> run("--bogus", "=1"));
		assertThrows(IllegalArgumentException.class, () -> run("-c"));
		assertThrows(IllegalArgumentException.class, () -> run("-m", "average", "=1"));
		assertThrows(IllegalArgumentException.class, () -> run("-c", "A1", "=B1"));
		assertThrows(IllegalArgumentException.class, () -> run(""));
	}

	@Test
	public void testInvalidFormula() {
		assertThrows(ParserException.class, () -> run("=(1"));
	}

	@Test
	public void testExecuteReportsErrors() throws IOException {
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8.name());
		Cli cli = new Cli(new ByteArrayInputStream(new byte[0]), new PrintStream(new ByteArrayOutputStream()), errStream);
		assertEquals(1, cli.execute(new String[] { "=(1" }));
		assertEquals(
				"ParserException: Mismatched or misplaced parentheses",
				err.toString(StandardCharsets.UTF_8.name()).trim());

		err.reset();
		cli = new Cli(new ByteArrayInputStream(new byte[0]), new PrintStream(new ByteArrayOutputStream()), errStream);
		assertEquals(1, cli.execute(new String[] { "--bogus" }));
		assertTrue(err.toString(StandardCharsets.UTF_8.name()).startsWith("Invalid arguments: Unknown option: --bogus"));
	}

	@Test
	public void testExecuteReportsInvalidAddress() throws IOException {
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli cli = new Cli(
				new ByteArrayInputStream(new byte[0]),
				new PrintStream(new ByteArrayOutputStream()),
				new PrintStream(err, true, StandardCharsets.UTF_8.name()));
		assertEquals(1, cli.execute(new String[] { "=A99999999999" }));
		assertEquals(
				"ParserException: Invalid cell address: A99999999999",
				err.toString(StandardCharsets.UTF_8.name()).trim());
	}

	@Test
	public void testExecute() throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Cli cli = new Cli(
				new ByteArrayInputStream(new byte[0]),
				new PrintStream(out, true, StandardCharsets.UTF_8.name()),
				new PrintStream(new ByteArrayOutputStream()));
		assertEquals(0, cli.execute(new String[] { "=A1^2" }));
		assertEquals("eval_cell(\"A1\") ** 2", out.toString(StandardCharsets.UTF_8.name()).trim());
	}

	@Test
	public void testParse() {
		Cli cli = new Cli();
		cli.parse(new String[] { "-c", "Sheet1!A1", "--dump-syntax", "=1", "=2" });
		assertEquals("Sheet1!A1", cli.getCurrentCell());
		assertTrue(cli.getSettings().isDumpSyntaxTree());
		assertEquals(2, cli.getFormulas().size());
	}
}
