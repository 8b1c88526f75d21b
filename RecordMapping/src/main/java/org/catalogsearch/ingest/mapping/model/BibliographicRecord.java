package org.catalogsearch.ingest.mapping.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The normalized document written to the index, one per catalog record. Empty values are left
 * out of the serialized form.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BibliographicRecord {
    @JsonProperty("identifier")
    String identifier;
    @JsonProperty("source")
    String source;
    @JsonProperty("source_link")
    String sourceLink;
    @JsonProperty("title")
    String title;
    @JsonProperty("alternate_titles")
    List<String> alternateTitles;
    @JsonProperty("creators")
    List<String> creators;
    @JsonProperty("contributors")
    List<Contributor> contributors;
    @JsonProperty("subjects")
    List<String> subjects;
    @JsonProperty("isbns")
    List<String> isbns;
    @JsonProperty("issns")
    List<String> issns;
    @JsonProperty("dois")
    List<String> dois;
    @JsonProperty("oclcs")
    List<String> oclcs;
    @JsonProperty("lccn")
    String lccn;
    @JsonProperty("country_of_publication")
    String countryOfPublication;
    @JsonProperty("languages")
    List<String> languages;
    @JsonProperty("publication_date")
    String publicationDate;
    @JsonProperty("content_type")
    String contentType;
    @JsonProperty("call_numbers")
    List<String> callNumbers;
    @JsonProperty("edition")
    String edition;
    @JsonProperty("imprint")
    List<String> imprint;
    @JsonProperty("physical_description")
    String physicalDescription;
    @JsonProperty("publication_frequency")
    List<String> publicationFrequency;
    @JsonProperty("numbering")
    String numbering;
    @JsonProperty("notes")
    List<String> notes;
    @JsonProperty("contents")
    List<String> contents;
    @JsonProperty("summary")
    List<String> summary;
    @JsonProperty("format")
    List<String> format;
    @JsonProperty("literary_form")
    String literaryForm;
    @JsonProperty("related_place")
    List<String> relatedPlace;
    @JsonProperty("in_bibliography")
    List<String> inBibliography;
    @JsonProperty("related_items")
    List<RelatedItem> relatedItems;
    @JsonProperty("links")
    List<Link> links;
    @JsonProperty("holdings")
    List<Holding> holdings;
}
