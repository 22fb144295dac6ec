package sglib.targets.test;

import junit.framework.TestCase;
import sglib.targets.AnnotatedTarget;
import sglib.targets.GuideTarget;

public class GuideTargetTest extends TestCase {
	public void testIdentityKey() {
		GuideTarget t = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr1", 100, 120, false);
		assertEquals("ACGTACGTACGTACGTACGT_AGG_chr1_100_120_fwd", t.getIdentityKey());
		GuideTarget copy = GuideTarget.fromIdentityKey(t.getIdentityKey());
		assertEquals(t, copy);
		assertEquals(t.hashCode(), copy.hashCode());
		assertEquals(100, copy.getStart());
		assertEquals(120, copy.getEnd());
		assertEquals("AGG", copy.getMotif());
		assertFalse(copy.isReverse());
	}
	public void testKeyWithSeparatorInSequenceName() {
		GuideTarget t = new GuideTarget("TTTT", "TGG", "NC_000913_3", 7, 11, true);
		String key = t.getIdentityKey();
		assertEquals("TTTT_TGG_NC_000913_3_7_11_rev", key);
		GuideTarget copy = GuideTarget.fromIdentityKey(key);
		assertEquals("NC_000913_3", copy.getSequenceName());
		assertEquals("TTTT", copy.getSequence());
		assertTrue(copy.isReverse());
		assertEquals(key, copy.getIdentityKey());
	}
	public void testMalformedKeys() {
		String [] keys = {"AAAA", "AAAA_TGG_chr1_0_4_up", "AAAA_TGG_chr1_x_4_fwd", "AAAA_TGG_chr1_0_5_fwd"};
		for(String key:keys) {
			try {
				GuideTarget.fromIdentityKey(key);
				fail("Key "+key+" should be rejected");
			} catch (IllegalArgumentException e) {
				//Expected
			}
		}
	}
	public void testSpecificityOnlyIncreases() {
		GuideTarget t = new GuideTarget("AAAA", "TGG", "chr1", 0, 4, false);
		assertEquals(0, t.getSpecificity());
		assertTrue(t.updateSpecificity(30));
		assertFalse(t.updateSpecificity(20));
		assertFalse(t.updateSpecificity(30));
		assertEquals(30, t.getSpecificity());
	}
	public void testAnnotatedCopy() {
		GuideTarget t = new GuideTarget("AAAA", "TGG", "chr1", 0, 4, false);
		t.updateSpecificity(11);
		AnnotatedTarget unannotated = new AnnotatedTarget(t);
		assertFalse(unannotated.isAnnotated());
		assertNull(unannotated.getOffset());
		assertEquals(11, unannotated.getSpecificity());
		AnnotatedTarget annotated = new AnnotatedTarget(t, "geneA", 5, Boolean.TRUE);
		assertTrue(annotated.isAnnotated());
		assertEquals(t.getIdentityKey(), annotated.getTargetKey());
		t.updateSpecificity(39);
		assertEquals(11, annotated.getSpecificity());
	}
}
