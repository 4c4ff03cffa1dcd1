package ch.so.arp.lograg.ingest;

/**
 * Textual rendering of a group of consecutive log records of one file.
 *
 * @param source the identifier of the originating log file
 * @param index  position of the document within its file
 * @param text   the rendered records, newline separated
 */
record Document(String source, int index, String text) {
}
