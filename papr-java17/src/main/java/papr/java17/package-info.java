/// Reads and writes Papr, a column-sensitive key-value text format.
///
/// ## Parsing
/// [papr.java17.Papr#parse(String)] turns text into a tree of
/// [papr.java17.PaprNode]s in four steps: the text is split into text and colon
/// tokens, the tokens are attached to one another by comparing their columns,
/// the raw tree is simplified into canonical form, and the canonical root is
/// returned. A document that cannot be attached yields the invalid sentinel;
/// [papr.java17.Papr#tryParse(String)] returns the structured
/// [papr.java17.PaprParseError] instead.
///
/// ## Reading values
/// Lookups are total. Missing keys and out-of-range indices return the invalid
/// sentinel, which answers every query with empty text:
/// ```java
/// var port = root.get("server").get("port").value();
/// ```
///
/// ## Writing documents
/// [papr.java17.Papr#serialize(PaprNode)] writes canonical text from a simplified
/// copy of a tree, quoting any text the tokenizer would otherwise split or trim.
///
/// Logging uses `java.util.logging` under the `papr.java17` logger hierarchy.
package papr.java17;
