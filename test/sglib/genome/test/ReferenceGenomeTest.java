package sglib.genome.test;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Map;

import junit.framework.TestCase;
import sglib.genome.ReferenceGenome;

public class ReferenceGenomeTest extends TestCase {
	
	public void testMerge() throws IOException {
		File f1 = createFasta(">chr1\nACGTACGT\n");
		File f2 = createFasta(">chr2\nGGG\n>chr3\nTT\n");
		File merged = File.createTempFile("merged", ".fa");
		try {
			ReferenceGenome genome = ReferenceGenome.merge(Arrays.asList(f1.getAbsolutePath(), f2.getAbsolutePath()), merged.getAbsolutePath());
			assertEquals(merged.getAbsolutePath(), genome.getFilename());
			assertEquals(3, genome.getNumSequences());
			assertEquals(13, genome.getTotalLength());
			Map<String,Integer> lengths = genome.getSequenceLengths();
			assertEquals(Arrays.asList("chr1","chr2","chr3"), Arrays.asList(lengths.keySet().toArray()));
			assertEquals(8, lengths.get("chr1").intValue());
			
			ReferenceGenome reloaded = new ReferenceGenome(merged.getAbsolutePath());
			assertEquals(3, reloaded.getNumSequences());
			assertEquals("GGG", reloaded.getSequenceCharacters("chr2").toString());
			assertNull(reloaded.getSequenceCharacters("chrX"));
		} finally {
			f1.delete();
			f2.delete();
			merged.delete();
		}
	}
	
	public void testDuplicatedSequenceAcrossFiles() throws IOException {
		File f1 = createFasta(">chr1\nACGT\n");
		File f2 = createFasta(">chr1\nGGGG\n");
		File merged = File.createTempFile("merged", ".fa");
		try {
			ReferenceGenome.merge(Arrays.asList(f1.getAbsolutePath(), f2.getAbsolutePath()), merged.getAbsolutePath());
			fail("Sequence names repeated across files should be rejected");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("chr1"));
		} finally {
			f1.delete();
			f2.delete();
			merged.delete();
		}
	}
	
	private static File createFasta(String content) throws IOException {
		File file = File.createTempFile("genome", ".fa");
		try (PrintStream out = new PrintStream(file)) {
			out.print(content);
		}
		return file;
	}
}
