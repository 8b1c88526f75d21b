package org.catalogsearch.ingest.mapping.lookup;

import static java.util.Map.entry;

import java.util.Map;

import lombok.experimental.UtilityClass;

/**
 * Display names for the location, collection and item format codes found in holdings fields.
 * Codes without an entry are returned unchanged, except formats which fall back to
 * {@link #PRINT_VOLUME}.
 */
@UtilityClass
public class HoldingsTables {
    public static final String PRINT_VOLUME = "Print volume";
    public static final String INTERNET_RESOURCE = "Internet Resource";

    private static final Map<String, String> LOCATIONS = Map.ofEntries(
        entry("HUM", "Hayden Library"),
        entry("RBR", "Hayden Library"),
        entry("SCI", "Hayden Library"),
        entry("MIT50", "MIT Administrative Library"),
        entry("ARC", "Institute Archives"),
        entry("ACQ", "Institute Archives"),
        entry("ENG", "Barker Library"),
        entry("CAT", "Cataloging and Metadata Services"),
        entry("DEW", "Dewey Library"),
        entry("DIR", "Director's Office"),
        entry("DOC", "Document Services"),
        entry("ILB", "Interlibrary Borrowing"),
        entry("LSA", "Library Storage Annex"),
        entry("NET", INTERNET_RESOURCE),
        entry("MUS", "Lewis Music Library"),
        entry("PHY", "Physics Department Reading Room"),
        entry("RTC", "Rotch Library"),
        entry("RVC", "Rotch Visual Collections"),
        entry("SPC", "Space Cntr: Ask library staff"),
        entry("OFFIC", "Office delivery")
    );

    private static final Map<String, String> COLLECTIONS = Map.ofEntries(
        entry("STACK", "Stacks"),
        entry("ATLCS", "Atlas Case"),
        entry("AUDBK", "Audiobooks"),
        entry("JRNAL", "Journal Collection"),
        entry("BRWS", "Browsery"),
        entry("CNSUS", "Census Collection"),
        entry("CIRCD", "Service Desk"),
        entry("DETEC", "Detective Fiction Collection"),
        entry("EJ", "Electronic Journal"),
        entry("GIS", "GIS Collection"),
        entry("GOV", "Government Documents"),
        entry("GRNVL", "Graphic Novel Collection"),
        entry("HDCBX", "Harvard Depository Boxed Items"),
        entry("ICPSR", "ICPSR Codebooks"),
        entry("IMPLS", "Impulse Borrowing Display"),
        entry("LSA4", "Journal Collection"),
        entry("OVRSZ", "Oversize Materials"),
        entry("LMTED", "Limited Access Collection"),
        entry("MAPRM", "Map Room"),
        entry("MFORM", "Microforms"),
        entry("MEDIA", "Media"),
        entry("NCIP", "BLC ILB Item"),
        entry("NEWBK", "Science New Books Display"),
        entry("NOLN1", "Noncirculating Collection 1"),
        entry("NOLN2", "Noncirculating Collection 2"),
        entry("NOLN3", "Noncirculating Collection 3"),
        entry("OCC", "Off Campus Collection"),
        entry("OCCBX", "Off Campus Collection Boxed Items"),
        entry("OFFCT", "Offsite Cataloging"),
        entry("PAMPH", "Pamphlet Collection"),
        entry("PRECT", "Pre-cataloged Collection"),
        entry("REF", "Reference Collection"),
        entry("RSERV", "Reserve Stacks"),
        entry("SWING", "Basement Grammar Books"),
        entry("TRAVL", "Travel Collection"),
        entry("UNCAT", "Uncataloged Materials - see Librarian"),
        entry("UNKNW", "Problems Materials - see Librarian"),
        entry("WSTM", "Women in Science, Technology, and Medicine")
    );

    // Collections whose name depends on the raw location code
    private static final Map<String, Map<String, String>> COLLECTIONS_BY_LOCATION = Map.of(
        "JRNAL", Map.of("HUM", "Humanities Journals", "SCI", "Science Journals"),
        "PRECT", Map.of("HUM", "Humanities Pre-cataloged Collection", "SCI", "Science Pre-cataloged Collection")
    );

    private static final Map<String, String> FORMATS = Map.ofEntries(
        entry("BOOKS", PRINT_VOLUME),
        entry("REGULAR", PRINT_VOLUME),
        entry("ATLAS", "Atlas"),
        entry("AUDIO", "Audio tape"),
        entry("AUDTAPE", "Audio tape"),
        entry("CD", "Compact disc"),
        entry("CDROM", "CD-ROM"),
        entry("DSKETTE", "Diskette"),
        entry("DVD", "DVD-ROM"),
        entry("FICHE", "Microfiche"),
        entry("FOLIO", "Oversized print volume"),
        entry("OVRSIZE", "Oversized print volume"),
        entry("MAP", "Map sheet"),
        entry("MFILM", "Microfilm"),
        entry("RECORD", "Audio record"),
        entry("SCORE", "Musical score"),
        entry("SMALL", "Undersized print volume"),
        entry("VDISC", "Videodisc"),
        entry("VHS", "VHS")
    );

    public String location(String locationCode) {
        return LOCATIONS.getOrDefault(locationCode, locationCode);
    }

    public String collection(String collectionCode, String locationCode) {
        var byLocation = COLLECTIONS_BY_LOCATION.get(collectionCode);
        if (byLocation != null && byLocation.containsKey(locationCode)) {
            return byLocation.get(locationCode);
        }
        return COLLECTIONS.getOrDefault(collectionCode, collectionCode);
    }

    /** Format of an item held at {@code resolvedLocation}; online resources have no physical format. */
    public String format(String resolvedLocation, String formatCode) {
        if (INTERNET_RESOURCE.equals(resolvedLocation)) {
            return "";
        }
        return FORMATS.getOrDefault(formatCode, PRINT_VOLUME);
    }
}
