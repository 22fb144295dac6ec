package sglib.genome.io.test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import junit.framework.TestCase;
import sglib.genome.TargetRegion;
import sglib.genome.io.GFF3RegionsLoader;
import sglib.targets.AnnotatedTarget;
import sglib.targets.GuideTarget;
import sglib.targets.TargetsAnnotator;

public class GFF3RegionsLoaderTest extends TestCase {
	
	public void testGenesAndCDSFallback() throws IOException {
		StringBuilder text = new StringBuilder();
		text.append("##gff-version 3\n");
		text.append("chr1\tRefSeq\tgene\t201\t300\t.\t-\t.\tID=gene2;locus_tag=b0002;gene=thrA\n");
		text.append("chr1\tRefSeq\tCDS\t201\t300\t.\t-\t0\tID=cds2;locus_tag=b0002c\n");
		text.append("chr1\tRefSeq\tgene\t11\t50\t.\t+\t.\tID=gene1;Name=thrL\n");
		text.append("chr2\tRefSeq\tCDS\t1\t90\t.\t.\t0\tID=cds3;gene=orf1\n");
		text.append("chr2\tRefSeq\tregion\t1\t5000\t.\t+\t.\tID=chr2\n");
		text.append("chr2\tRefSeq\tCDS\tx\t90\t.\t+\t0\tID=cds4\n");
		text.append("##FASTA\n");
		text.append(">chr1\n");
		GFF3RegionsLoader loader = new GFF3RegionsLoader();
		List<TargetRegion> regions = loader.loadRegions(toStream(text));
		assertEquals(1, loader.getNumSkippedLines());
		assertEquals(4, regions.size());
		TargetRegion r = regions.get(0);
		assertEquals("thrL", r.getGene());
		assertEquals(10, r.getStart());
		assertEquals(50, r.getEnd());
		assertTrue(r.isPositiveStrand());
		r = regions.get(1);
		assertEquals("b0002", r.getGene());
		assertEquals(200, r.getStart());
		assertTrue(r.isNegativeStrand());
		assertEquals("orf1", regions.get(2).getGene());
		assertEquals("chr2", regions.get(2).getSequenceName());
		assertTrue(regions.get(2).isPositiveStrand());
		assertTrue(regions.get(3).isNegativeStrand());
	}
	
	public void testSplitCDSIsOneRegion() throws IOException {
		StringBuilder text = new StringBuilder();
		text.append("chr1\tRefSeq\tCDS\t101\t200\t.\t-\t0\tID=cds1;locus_tag=G1\n");
		text.append("chr1\tRefSeq\tCDS\t301\t400\t.\t-\t0\tID=cds1;locus_tag=G1\n");
		text.append("chr1\tRefSeq\tCDS\t501\t550\t.\t+\t0\tlocus_tag=G2\n");
		text.append("chr1\tRefSeq\tCDS\t601\t650\t.\t+\t0\tlocus_tag=G2\n");
		List<TargetRegion> regions = new GFF3RegionsLoader().loadRegions(toStream(text));
		assertEquals(2, regions.size());
		TargetRegion r = regions.get(0);
		assertEquals("G1", r.getGene());
		assertEquals(100, r.getStart());
		assertEquals(400, r.getEnd());
		assertTrue(r.isNegativeStrand());
		r = regions.get(1);
		assertEquals("G2", r.getGene());
		assertEquals(500, r.getStart());
		assertEquals(650, r.getEnd());
		
		//Offsets are measured from the transcription start of the whole feature
		GuideTarget target = new GuideTarget("ACGTACGTACGTACGTACGT", "AGG", "chr1", 110, 130, false);
		AnnotatedTarget annotated = TargetsAnnotator.annotate(target, regions.get(0));
		assertEquals(270, annotated.getOffset().intValue());
	}
	
	public void testFeatureWithoutName() {
		String text = "chr1\tRefSeq\tgene\t11\t50\t.\t+\t.\tNote=unnamed\n";
		try {
			new GFF3RegionsLoader().loadRegions(toStream(text));
			fail("Features without names should be rejected");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("line 1"));
		}
	}
	
	public void testIncompleteLine() {
		String text = "chr1\tRefSeq\tgene\t11\t50\n";
		try {
			new GFF3RegionsLoader().loadRegions(toStream(text));
			fail("Lines with less than nine fields should be rejected");
		} catch (IOException e) {
			//Expected
		}
	}
	
	private static ByteArrayInputStream toStream(CharSequence text) {
		return new ByteArrayInputStream(text.toString().getBytes(StandardCharsets.UTF_8));
	}
}
