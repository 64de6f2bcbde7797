package org.metricshub.jformula;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Checks that emitted code makes the grouping of every operation explicit.
 */
@RunWith(Parameterized.class)
public class OperatorPrecedenceTest {

	@Parameter(0)
	public String formula;

	@Parameter(1)
	public String expected;

	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		return Arrays
				.asList(
						new Object[][] {
								{ "=1+2*3", "1 + (2 * 3)" },
								{ "=1*2+3", "(1 * 2) + 3" },
								{ "=1-2-3", "(1 - 2) - 3" },
								{ "=8/4/2", "(8 / 4) / 2" },
								{ "=2^3^2", "(2 ** 3) ** 2" },
								{ "=2*3^2", "2 * (3 ** 2)" },
								{ "=2^3*2", "(2 ** 3) * 2" },
								{ "=-2^2", "(-2) ** 2" },
								{ "=2^-2", "2 ** (-2)" },
								{ "=-1+2", "(-1) + 2" },
								{ "=1+2-3+4", "((1 + 2) - 3) + 4" },
								{ "=1-2*3/4+5", "(1 - ((2 * 3) / 4)) + 5" },
								{ "=1&2=3", "(1 + 2) == 3" },
								{ "=1+2&3", "(1 + 2) + 3" },
								{ "=5%*2", "(5 / 100) * 2" },
								{ "=2*+3", "2 * 3" },
								{ "=2^+3", "2 ** 3" },
								{ "=+2^2", "2 ** 2" },
								{ "=(1+2)*3", "(1 + 2) * 3" } });
	}

	@Test
	public void testGrouping() {
		assertEquals(expected, new FormulaCompiler().compile(formula).getCode());
	}
}
