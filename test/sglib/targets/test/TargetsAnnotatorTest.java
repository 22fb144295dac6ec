package sglib.targets.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import junit.framework.TestCase;
import sglib.genome.TargetRegion;
import sglib.targets.AnnotatedTarget;
import sglib.targets.AnnotationSweepCursor;
import sglib.targets.GuideTarget;
import sglib.targets.MotifPattern;
import sglib.targets.TargetsAnnotator;
import sglib.targets.TargetsExtractor;

public class TargetsAnnotatorTest extends TestCase {
	
	private Map<String,Integer> lengths = new LinkedHashMap<>();
	
	@Override
	protected void setUp() {
		lengths.put("chr1", 1000);
		lengths.put("chr2", 500);
	}
	
	public void testOffsetAndSense() {
		GuideTarget fwd = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr1", 110, 130, false);
		GuideTarget rev = new GuideTarget("ACGTACGTACGTACGTACGT", "TGG", "chr1", 110, 130, true);
		
		AnnotatedTarget a = TargetsAnnotator.annotate(fwd, new TargetRegion("g1", "chr1", 100, 200, '+'));
		assertEquals("g1", a.getGene());
		assertEquals(10, a.getOffset().intValue());
		assertTrue(a.getSenseStrand());
		
		a = TargetsAnnotator.annotate(fwd, new TargetRegion("g2", "chr1", 100, 200, '-'));
		assertEquals(70, a.getOffset().intValue());
		assertFalse(a.getSenseStrand());
		
		a = TargetsAnnotator.annotate(rev, new TargetRegion("g2", "chr1", 100, 200, '-'));
		assertEquals(70, a.getOffset().intValue());
		assertTrue(a.getSenseStrand());
		
		a = TargetsAnnotator.annotate(rev, new TargetRegion("g1", "chr1", 100, 200, '+'));
		assertEquals(10, a.getOffset().intValue());
		assertFalse(a.getSenseStrand());
	}
	
	public void testPartialAndFullOverlap() {
		GuideTarget partial = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr1", 90, 110, false);
		GuideTarget contained = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr1", 120, 140, false);
		GuideTarget outside = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr1", 300, 320, false);
		Map<String,GuideTarget> targets = buildTargets(outside, contained, partial);
		List<TargetRegion> regions = Arrays.asList(new TargetRegion("g1", "chr1", 100, 200, '+'));
		
		TargetsAnnotator annotator = new TargetsAnnotator();
		List<AnnotatedTarget> records = annotator.annotate(targets, regions, lengths);
		assertEquals(3, records.size());
		assertEquals(partial.getIdentityKey(), records.get(0).getTargetKey());
		assertEquals(-10, records.get(0).getOffset().intValue());
		assertEquals(contained.getIdentityKey(), records.get(1).getTargetKey());
		assertEquals("g1", records.get(1).getGene());
		assertFalse(records.get(2).isAnnotated());
		assertEquals(outside.getIdentityKey(), records.get(2).getTargetKey());
		
		annotator.setAllowPartialOverlap(false);
		records = annotator.annotate(targets, regions, lengths);
		assertEquals(3, records.size());
		assertEquals(contained.getIdentityKey(), records.get(0).getTargetKey());
		assertTrue(records.get(0).isAnnotated());
		//Unannotated targets follow the iteration order of the map
		assertEquals(outside.getIdentityKey(), records.get(1).getTargetKey());
		assertEquals(partial.getIdentityKey(), records.get(2).getTargetKey());
		assertFalse(records.get(2).isAnnotated());
	}
	
	public void testTargetInSeveralRegions() {
		GuideTarget t = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr1", 150, 170, true);
		Map<String,GuideTarget> targets = buildTargets(t);
		List<TargetRegion> regions = new ArrayList<>();
		regions.add(new TargetRegion("g1", "chr1", 100, 200, '+'));
		regions.add(new TargetRegion("g2", "chr1", 140, 400, '-'));
		List<AnnotatedTarget> records = new TargetsAnnotator().annotate(targets, regions, lengths);
		assertEquals(2, records.size());
		assertEquals("g1", records.get(0).getGene());
		assertEquals(50, records.get(0).getOffset().intValue());
		assertFalse(records.get(0).getSenseStrand());
		assertEquals("g2", records.get(1).getGene());
		assertEquals(230, records.get(1).getOffset().intValue());
		assertTrue(records.get(1).getSenseStrand());
	}
	
	public void testChromosomesAreIndependent() {
		GuideTarget t1 = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr1", 400, 420, false);
		GuideTarget t2 = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr2", 10, 30, false);
		Map<String,GuideTarget> targets = buildTargets(t1, t2);
		List<TargetRegion> regions = new ArrayList<>();
		regions.add(new TargetRegion("g1", "chr1", 350, 450, '+'));
		regions.add(new TargetRegion("g2", "chr2", 0, 100, '+'));
		List<AnnotatedTarget> records = new TargetsAnnotator().annotate(targets, regions, lengths);
		assertEquals(2, records.size());
		assertEquals("g1", records.get(0).getGene());
		assertEquals("chr1", records.get(0).getSequenceName());
		assertEquals("g2", records.get(1).getGene());
		assertEquals("chr2", records.get(1).getSequenceName());
	}
	
	public void testSkippedRegions() {
		GuideTarget t = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr2", 10, 30, false);
		Map<String,GuideTarget> targets = buildTargets(t);
		List<TargetRegion> regions = new ArrayList<>();
		regions.add(new TargetRegion("g1", "chrX", 0, 100, '+'));
		regions.add(new TargetRegion("g2", "chr2", 500, 600, '+'));
		regions.add(new TargetRegion("g3", "chr1", 0, 100, '+'));
		TargetsAnnotator annotator = new TargetsAnnotator();
		List<String> warnings = new ArrayList<>();
		annotator.setLog(createWarningsLogger(warnings));
		List<AnnotatedTarget> records = annotator.annotate(targets, regions, lengths);
		assertEquals(1, records.size());
		assertFalse(records.get(0).isAnnotated());
		assertEquals(2, annotator.getNumSkippedRegions());
		assertEquals(1, annotator.getNumRegionsWithoutTargets());
		assertTrue(containsMessage(warnings, "gene g1"));
		assertTrue(containsMessage(warnings, "gene g2"));
		assertTrue(containsMessage(warnings, "gene g3"));
	}
	
	public void testUnsortedRegionsAreRejected() {
		List<TargetRegion> regions = new ArrayList<>();
		regions.add(new TargetRegion("g1", "chr1", 200, 300, '+'));
		regions.add(new TargetRegion("g2", "chr2", 10, 30, '+'));
		regions.add(new TargetRegion("g3", "chr1", 100, 150, '+'));
		try {
			new TargetsAnnotator().annotate(new LinkedHashMap<>(), regions, lengths);
			fail("Unsorted regions should be rejected");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("g3"));
		}
	}
	
	public void testCursorOnlyMovesForward() {
		List<GuideTarget> sorted = new ArrayList<>();
		for(int i=0;i<10;i++) {
			sorted.add(new GuideTarget("ACGTACGTAC", "AGG", "chr1", 100*i, 100*i+10, false));
		}
		AnnotationSweepCursor cursor = AnnotationSweepCursor.START;
		cursor = TargetsAnnotator.advanceCursor(cursor, sorted, new TargetRegion("g1", "chr1", 150, 350, '+'), true);
		assertEquals(new AnnotationSweepCursor(2, 4), cursor);
		cursor = TargetsAnnotator.advanceCursor(cursor, sorted, new TargetRegion("g2", "chr1", 160, 250, '+'), true);
		assertEquals(new AnnotationSweepCursor(2, 4), cursor);
		cursor = TargetsAnnotator.advanceCursor(cursor, sorted, new TargetRegion("g3", "chr1", 695, 705, '+'), true);
		assertEquals(new AnnotationSweepCursor(7, 8), cursor);
		assertEquals(1, cursor.getWindowSize());
		//The target at 700-710 is not contained in the region
		cursor = TargetsAnnotator.advanceCursor(AnnotationSweepCursor.START, sorted, new TargetRegion("g4", "chr1", 695, 705, '+'), false);
		assertEquals(new AnnotationSweepCursor(7, 7), cursor);
		assertEquals(0, cursor.getWindowSize());
	}
	
	public void testWholeChromosomeRegion() {
		String genome = "GATTACAGGCCTAGGATCCAAGGTTCCGGAACCATGGTCAGGCATCCGTAAAGGTCCCAT";
		TargetsExtractor extractor = new TargetsExtractor(new MotifPattern(".GG"), 8);
		Map<String,GuideTarget> targets = new LinkedHashMap<>();
		extractor.extractTargets("chrT", genome, targets);
		assertTrue(targets.size()>2);
		Map<String,Integer> genomeLengths = new LinkedHashMap<>();
		genomeLengths.put("chrT", genome.length());
		List<TargetRegion> regions = TargetRegion.createRegions("geneT", "chrT", 0, genome.length(), '.');
		List<AnnotatedTarget> records = new TargetsAnnotator().annotate(targets, regions, genomeLengths);
		assertEquals(2*targets.size(), records.size());
		Set<String> keys = new HashSet<>();
		for(int i=0;i<records.size();i++) {
			AnnotatedTarget record = records.get(i);
			assertTrue(record.isAnnotated());
			assertEquals("geneT", record.getGene());
			boolean positiveGene = i<targets.size();
			assertEquals(positiveGene != record.isReverse(), record.getSenseStrand().booleanValue());
			keys.add(record.getTargetKey());
		}
		assertEquals(targets.keySet(), keys);
	}
	
	private static Logger createWarningsLogger(final List<String> warnings) {
		Logger logger = Logger.getAnonymousLogger();
		logger.setUseParentHandlers(false);
		logger.addHandler(new Handler() {
			@Override
			public void publish(LogRecord record) {
				if(record.getLevel().intValue()>=Level.WARNING.intValue()) warnings.add(record.getMessage());
			}
			@Override
			public void flush() {
			}
			@Override
			public void close() {
			}
		});
		return logger;
	}
	private static boolean containsMessage(List<String> messages, String text) {
		for(String message:messages) {
			if(message.contains(text)) return true;
		}
		return false;
	}
	
	private Map<String,GuideTarget> buildTargets(GuideTarget... targets) {
		Map<String,GuideTarget> answer = new LinkedHashMap<>();
		for(GuideTarget t:targets) answer.put(t.getIdentityKey(), t);
		return answer;
	}
}
