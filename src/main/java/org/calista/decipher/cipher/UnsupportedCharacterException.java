package org.calista.decipher.cipher;

/**
 * Ciphertext contains a character that is neither whitespace nor an uppercase letter,
 * and the active {@link CharacterPolicy} does not allow it.
 */
public final class UnsupportedCharacterException extends IllegalArgumentException {

    private final char character;
    private final int index;

    public UnsupportedCharacterException(char character, int index) {
        super("Unsupported character '" + character + "' (U+" + String.format("%04X", (int) character) + ") at index " + index);
        this.character = character;
        this.index = index;
    }

    public char character() {
        return character;
    }

    public int index() {
        return index;
    }
}
