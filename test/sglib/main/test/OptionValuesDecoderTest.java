package sglib.main.test;

import java.util.Arrays;

import junit.framework.TestCase;
import sglib.main.Command;
import sglib.main.CommandOption;
import sglib.main.CommandsDescriptor;
import sglib.main.OptionValuesDecoder;
import sglib.targets.GuideLibraryBuilder;

public class OptionValuesDecoderTest extends TestCase {
	public void testDecode() {
		assertEquals(20, OptionValuesDecoder.decode(" 20 ", Integer.class));
		assertEquals(0.5, OptionValuesDecoder.decode("0.5", Double.class));
		assertEquals(Boolean.TRUE, OptionValuesDecoder.decode("true", Boolean.class));
		assertEquals("NGG", OptionValuesDecoder.decode("NGG", String.class));
		assertTrue(Arrays.equals(new int[] {39,30,20,11,1}, (int[])OptionValuesDecoder.decode("39, 30,20,11,1", int[].class)));
		assertNull(OptionValuesDecoder.decode(null, Integer.class));
		try {
			OptionValuesDecoder.decode("3x", Integer.class);
			fail("Invalid numbers should be rejected");
		} catch (NumberFormatException e) {
			//Expected
		}
	}
	public void testCommandDescriptor() {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		Command command = descriptor.getCommand("BuildGuideLibrary");
		assertNotNull(command);
		assertEquals(GuideLibraryBuilder.class, command.getProgram());
		CommandOption tolerances = command.getOption("t");
		assertEquals("39,30,20,11,1", tolerances.getDefaultValue());
		assertEquals(CommandOption.TYPE_INT_LIST, tolerances.getType());
		assertEquals(".GG", command.getOption("m").getDefaultValue());
		assertEquals("20", command.getOption("w").getDefaultValue());
		assertNull(command.getOption("x"));
	}
}
