package sglib.targets.test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import sglib.sequences.QualifiedSequence;
import sglib.targets.GuideTarget;
import sglib.targets.MotifPattern;
import sglib.targets.TargetsExtractor;

public class TargetsExtractorTest extends TestCase {
	
	private TargetsExtractor extractor = new TargetsExtractor(new MotifPattern(".GG"), 4);
	
	public void testForwardTargets() {
		Map<String,GuideTarget> targets = extract("chr1","AAAATGGAAACGG");
		assertEquals(2, targets.size());
		GuideTarget t1 = targets.get("AAAA_TGG_chr1_0_4_fwd");
		assertNotNull(t1);
		assertEquals("AAAA", t1.getSequence());
		assertEquals("TGG", t1.getMotif());
		assertEquals(0, t1.getStart());
		assertEquals(4, t1.getEnd());
		assertFalse(t1.isReverse());
		assertEquals(0, t1.getSpecificity());
		GuideTarget t2 = targets.get("GAAA_CGG_chr1_6_10_fwd");
		assertNotNull(t2);
		assertEquals(6, t2.getStart());
		assertEquals(10, t2.getEnd());
	}
	
	public void testReverseTargets() {
		Map<String,GuideTarget> targets = extract("chr1","CCATTTT");
		assertEquals(1, targets.size());
		GuideTarget t = targets.values().iterator().next();
		assertEquals("AAAA", t.getSequence());
		assertEquals("TGG", t.getMotif());
		assertEquals(3, t.getStart());
		assertEquals(7, t.getEnd());
		assertTrue(t.isReverse());
		assertEquals("AAAA_TGG_chr1_3_7_rev", t.getIdentityKey());
	}
	
	public void testStrandSymmetry() {
		GuideTarget forward = extract("chr1","AAAATGG").values().iterator().next();
		GuideTarget reverse = extract("chr1","CCATTTT").values().iterator().next();
		assertEquals(forward.getSequence(), reverse.getSequence());
		assertEquals(forward.getMotif(), reverse.getMotif());
		assertFalse(forward.isReverse());
		assertTrue(reverse.isReverse());
		assertEquals(0, forward.getStart());
		assertEquals(3, reverse.getStart());
	}
	
	public void testUnknownBases() {
		assertEquals(0, extract("chr1","AAANTGG").size());
		assertEquals(0, extract("chr1","AAAATNG").size());
		assertEquals(0, extract("chr1","CCANTTT").size());
		//N outside the match does not discard the target
		assertEquals(1, extract("chr1","NAAAATGGN").size());
	}
	
	public void testOverlappingTargets() {
		//Motifs TGG at 4 and GGG at 5 share bases with the windows of each other
		Map<String,GuideTarget> targets = extract("chr1","AAAATGGG");
		assertTrue(targets.containsKey("AAAA_TGG_chr1_0_4_fwd"));
		assertTrue(targets.containsKey("AAAT_GGG_chr1_1_5_fwd"));
		assertEquals(2, targets.size());
	}
	
	public void testLowerCaseAndShortSequences() {
		assertEquals(1, extract("chr1","aaaatgg").size());
		assertEquals(0, extract("chr1","AATGG").size());
		assertEquals(0, extract("chr1","").size());
	}
	
	public void testIdempotence() {
		Map<String,GuideTarget> targets = extract("chr1","AAAATGGAAACGGTTCCAGTCA");
		int n = targets.size();
		extractor.extractTargets("chr1", "AAAATGGAAACGGTTCCAGTCA", targets);
		assertEquals(n, targets.size());
	}
	
	public void testMultipleSequences() {
		List<QualifiedSequence> sequences = new ArrayList<>();
		sequences.add(new QualifiedSequence("chr1", "AAAATGG"));
		sequences.add(new QualifiedSequence("chr2", "AAAATGG"));
		Map<String,GuideTarget> targets = extractor.extractTargets(sequences);
		assertEquals(2, targets.size());
		List<String> keys = new ArrayList<>(targets.keySet());
		assertEquals("AAAA_TGG_chr1_0_4_fwd", keys.get(0));
		assertEquals("AAAA_TGG_chr2_0_4_fwd", keys.get(1));
	}
	
	public void testCoordinatesMatchGenome() {
		String genome = "GATTACAGGCCTAGGATCCAAGGTTCCGGAACCATGG";
		TargetsExtractor ext = new TargetsExtractor(new MotifPattern("NGG"), 6);
		Map<String,GuideTarget> targets = new LinkedHashMap<>();
		ext.extractTargets("chrM", genome, targets);
		assertTrue(targets.size()>0);
		for(GuideTarget t:targets.values()) {
			assertEquals(6, t.getEnd()-t.getStart());
			String window = genome.substring(t.getStart(), t.getEnd());
			if(t.isReverse()) {
				assertEquals(sglib.sequences.DNASequence.getReverseComplement(window), t.getSequence());
				String motif = genome.substring(t.getStart()-3, t.getStart());
				assertEquals(sglib.sequences.DNASequence.getReverseComplement(motif), t.getMotif());
			} else {
				assertEquals(window, t.getSequence());
				assertEquals(genome.substring(t.getEnd(), t.getEnd()+3), t.getMotif());
			}
			assertTrue(t.getMotif().endsWith("GG"));
		}
	}
	
	private Map<String,GuideTarget> extract(String name, String bases) {
		Map<String,GuideTarget> targets = new LinkedHashMap<>();
		extractor.extractTargets(name, bases, targets);
		return targets;
	}
}
