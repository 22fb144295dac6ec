package sglib.genome.io.test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import junit.framework.TestCase;
import sglib.genome.TargetRegion;
import sglib.genome.io.GenbankGenomeLoader;
import sglib.sequences.QualifiedSequence;
import sglib.sequences.QualifiedSequenceList;

public class GenbankGenomeLoaderTest extends TestCase {
	private static final String SEQUENCE_1 = "GATTACAGGCCTAGGATCCAAGGTTCCGGAACCATGGTCAGGCATCCGTAAAGGTCCCAT";
	private static final String SEQUENCE_2 = "TTGACCGGTAACGGTCAATGCCAGTTGCATGCAACCGGTTAAGCTTACGTACGGATCCAA";
	
	public void testGenesAndCDSFallbackPerRecord() throws IOException {
		StringBuilder text = new StringBuilder();
		appendRecord(text, "chrA", SEQUENCE_1,
				feature("gene", "1..30", "/locus_tag=\"A0001\"", "/gene=\"geneA\""),
				feature("CDS", "1..30", "/locus_tag=\"A0001c\""),
				feature("gene", "complement(31..60)", "/gene=\"geneB\""));
		appendRecord(text, "chrB", SEQUENCE_2,
				feature("CDS", "join(5..20,41..50)", "/locus_tag=\"B0001\""));
		GenbankGenomeLoader loader = new GenbankGenomeLoader();
		loader.load(toStream(text), "test.gb");
		QualifiedSequenceList sequences = loader.getSequences();
		assertEquals(2, sequences.size());
		QualifiedSequence seq1 = sequences.get(0);
		QualifiedSequence seq2 = sequences.get(1);
		assertEquals(SEQUENCE_1, seq1.getCharacters().toString());
		assertEquals(SEQUENCE_2, seq2.getCharacters().toString());
		
		List<TargetRegion> regions = loader.getRegions();
		assertEquals(3, regions.size());
		TargetRegion r = regions.get(0);
		assertEquals("A0001", r.getGene());
		assertEquals(seq1.getName(), r.getSequenceName());
		assertEquals(0, r.getStart());
		assertEquals(30, r.getEnd());
		assertTrue(r.isPositiveStrand());
		r = regions.get(1);
		assertEquals("geneB", r.getGene());
		assertEquals(30, r.getStart());
		assertEquals(60, r.getEnd());
		assertTrue(r.isNegativeStrand());
		r = regions.get(2);
		assertEquals("B0001", r.getGene());
		assertEquals(seq2.getName(), r.getSequenceName());
		assertEquals(4, r.getStart());
		assertEquals(50, r.getEnd());
	}
	
	public void testFilesAreMergedInOrder() throws IOException {
		StringBuilder text1 = new StringBuilder();
		appendRecord(text1, "chrB", SEQUENCE_2, feature("gene", "1..10", "/locus_tag=\"B0001\""));
		StringBuilder text2 = new StringBuilder();
		appendRecord(text2, "chrA", SEQUENCE_1, feature("gene", "11..20", "/locus_tag=\"A0001\""));
		GenbankGenomeLoader loader = new GenbankGenomeLoader();
		loader.load(toStream(text1), "first.gb");
		loader.load(toStream(text2), "second.gb");
		QualifiedSequenceList sequences = loader.getSequences();
		assertEquals(2, sequences.size());
		assertEquals(SEQUENCE_2, sequences.get(0).getCharacters().toString());
		assertEquals(SEQUENCE_1, sequences.get(1).getCharacters().toString());
		assertEquals(2, loader.getRegions().size());
		try {
			loader.load(toStream(text2), "third.gb");
			fail("Repeated sequence names should not be accepted");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("third.gb"));
		}
	}
	
	public void testFeatureWithoutName() {
		StringBuilder text = new StringBuilder();
		appendRecord(text, "chrA", SEQUENCE_1, feature("gene", "1..30", "/note=\"unnamed\""));
		try {
			new GenbankGenomeLoader().load(toStream(text), "test.gb");
			fail("Features without locus_tag or gene should not be accepted");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("locus_tag"));
		}
	}
	
	private static String feature(String type, String location, String... qualifiers) {
		StringBuilder answer = new StringBuilder();
		answer.append("     ").append(type);
		for(int i=type.length();i<16;i++) answer.append(' ');
		answer.append(location).append('\n');
		for(String q:qualifiers) answer.append("                     ").append(q).append('\n');
		return answer.toString();
	}
	private static void appendRecord(StringBuilder text, String name, String sequence, String... features) {
		text.append("LOCUS       ").append(name).append("                      ").append(sequence.length()).append(" bp    DNA     linear   BCT 01-JAN-2020\n");
		text.append("DEFINITION  Test record ").append(name).append(".\n");
		text.append("ACCESSION   ").append(name).append('\n');
		text.append("VERSION     ").append(name).append(".1\n");
		text.append("FEATURES             Location/Qualifiers\n");
		text.append(feature("source", "1.."+sequence.length(), "/organism=\"test\""));
		for(String f:features) text.append(f);
		text.append("ORIGIN\n");
		String lower = sequence.toLowerCase();
		for(int i=0;i<lower.length();i+=60) {
			String number = String.valueOf(i+1);
			for(int j=number.length();j<9;j++) text.append(' ');
			text.append(number);
			int end = Math.min(i+60, lower.length());
			for(int j=i;j<end;j+=10) text.append(' ').append(lower, j, Math.min(j+10, end));
			text.append('\n');
		}
		text.append("//\n");
	}
	private static InputStream toStream(StringBuilder text) {
		return new ByteArrayInputStream(text.toString().getBytes(StandardCharsets.UTF_8));
	}
}
