package belc.model;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The vocabularies built into BEL: default protein and gene modification names, molecular activity labels, and
 * the amino acid and nucleotide codes used by the legacy substitution syntax. Each table maps every accepted
 * spelling to its canonical one.
 */
public final class BuiltinLabels {

	private BuiltinLabels() {}

	public static final Map<String, String> ACTIVITIES = ImmutableMap.<String, String>builder()
			.put("catalyticActivity", "cat").put("cat", "cat")
			.put("chaperoneActivity", "chap").put("chap", "chap")
			.put("gtpBoundActivity", "gtp").put("gtp", "gtp")
			.put("kinaseActivity", "kin").put("kin", "kin")
			.put("peptidaseActivity", "pep").put("pep", "pep")
			.put("phosphataseActivity", "phos").put("phos", "phos")
			.put("ribosylationActivity", "ribo").put("ribo", "ribo")
			.put("transcriptionalActivity", "tscript").put("tscript", "tscript")
			.put("transportActivity", "tport").put("tport", "tport")
			.put("guanineNucleotideExchangeFactorActivity", "gef").put("gef", "gef")
			.put("gtpaseActivatingProteinActivity", "gap").put("gap", "gap")
			.put("molecularActivity", "molecularActivity")
			.build();

	public static final Map<String, String> AMINO_ACIDS = ImmutableMap.<String, String>builder()
			.put("A", "Ala").put("R", "Arg").put("N", "Asn").put("D", "Asp").put("C", "Cys")
			.put("E", "Glu").put("Q", "Gln").put("G", "Gly").put("H", "His").put("I", "Ile")
			.put("L", "Leu").put("K", "Lys").put("M", "Met").put("F", "Phe").put("P", "Pro")
			.put("S", "Ser").put("T", "Thr").put("W", "Trp").put("Y", "Tyr").put("V", "Val")
			.build();

	public static final Map<String, String> PROTEIN_MODIFICATIONS = ImmutableMap.<String, String>builder()
			.put("Ac", "Ac").put("acetylation", "Ac")
			.put("ADPRib", "ADPRib").put("ADP-ribosylation", "ADPRib").put("adenosine diphosphoribosyl", "ADPRib")
			.put("Farn", "Farn").put("farnesylation", "Farn")
			.put("Gerger", "Gerger").put("geranylgeranylation", "Gerger")
			.put("Glyco", "Glyco").put("glycosylation", "Glyco")
			.put("Hy", "Hy").put("hydroxylation", "Hy")
			.put("ISG", "ISG").put("ISGylation", "ISG").put("ISG15-protein conjugation", "ISG")
			.put("Me", "Me").put("methylation", "Me")
			.put("Me1", "Me1").put("monomethylation", "Me1").put("mono-methylation", "Me1")
			.put("Me2", "Me2").put("dimethylation", "Me2").put("di-methylation", "Me2")
			.put("Me3", "Me3").put("trimethylation", "Me3").put("tri-methylation", "Me3")
			.put("Myr", "Myr").put("myristoylation", "Myr")
			.put("Nedd", "Nedd").put("neddylation", "Nedd")
			.put("NGlyco", "NGlyco").put("N-linked glycosylation", "NGlyco")
			.put("NO", "NO").put("Nitrosylation", "NO")
			.put("OGlyco", "OGlyco").put("O-linked glycosylation", "OGlyco")
			.put("Palm", "Palm").put("palmitoylation", "Palm")
			.put("Ph", "Ph").put("phosphorylation", "Ph")
			.put("Sulf", "Sulf").put("sulfation", "Sulf").put("sulphation", "Sulf")
			.put("sulfur addition", "Sulf").put("sulphur addition", "Sulf")
			.put("sulfonation", "sulfonation").put("sulphonation", "sulfonation")
			.put("Sumo", "Sumo").put("SUMOylation", "Sumo")
			.put("Ub", "Ub").put("ubiquitination", "Ub").put("ubiquitinylation", "Ub").put("ubiquitylation", "Ub")
			.put("UbK48", "UbK48").put("Lysine 48-linked polyubiquitination", "UbK48")
			.put("UbK63", "UbK63").put("Lysine 63-linked polyubiquitination", "UbK63")
			.put("UbMono", "UbMono").put("monoubiquitination", "UbMono")
			.put("UbPoly", "UbPoly").put("polyubiquitination", "UbPoly")
			.put("Ox", "Ox").put("oxidation", "Ox")
			.build();

	// BEL 1.0 single letter modification codes
	public static final Map<String, String> LEGACY_PROTEIN_MODIFICATIONS = ImmutableMap.<String, String>builder()
			.put("P", "Ph").put("A", "Ac").put("F", "Farn").put("G", "Glyco").put("H", "Hy")
			.put("M", "Me").put("R", "ADPRib").put("S", "Sumo").put("U", "Ub").put("O", "Ox")
			.build();

	public static final Map<String, String> GENE_MODIFICATIONS = ImmutableMap.of(
			"Me", "Me",
			"methylation", "Me");

	public static final Map<String, String> LEGACY_GENE_MODIFICATIONS = ImmutableMap.of("M", "Me");

	public static final String DNA_NUCLEOTIDES = "ATCG";
}
