package ledgerlink.sheets.exceptions;

/**
 * Exception thrown when a PEM private key carries markers but too little base64 content to be a complete RSA key.
 * Usually the result of a partial copy/paste.
 */
public class KeyTruncatedException extends KeyFormatException {

    private final int contentLength;

    public KeyTruncatedException(int contentLength) {
        super("Private key appears to be truncated: " + contentLength + " characters");
        this.contentLength = contentLength;
    }

    /**
     * @return number of base64 characters found between the PEM markers
     */
    public int getContentLength() {
        return contentLength;
    }
}
