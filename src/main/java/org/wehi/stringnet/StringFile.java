package org.wehi.stringnet;

/**
 * The STRING dump files a database is built from.
 * Declaration order is the order files are loaded in: the links file establishes the proteins
 * the aliases file refers to.
 */
public enum StringFile {
    PROTEIN_LINKS("protein.links.detailed"),
    PROTEIN_ALIASES("protein.aliases");

    private final String baseName;

    StringFile(String baseName) {
        this.baseName = baseName;
    }

    public String getBaseName() {
        return baseName;
    }

    /**
     * @param species NCBI taxonomy id, empty or null for the all-species file
     * @param version STRING release, e.g. "11.0"
     * @return file name, e.g. 10090.protein.links.detailed.v11.0.txt.gz
     */
    public String fileName(String species, String version) {
        String name = baseName + ".v" + version + ".txt.gz";
        if (species == null || species.isEmpty()) {
            return name;
        }
        return species + "." + name;
    }
}
