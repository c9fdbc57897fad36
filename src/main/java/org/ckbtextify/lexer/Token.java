package org.ckbtextify.lexer;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single lexical unit produced by the {@link Tokenizer} and rewritten in place by the
 * normalization modules.
 * <p>
 * A token whose {@link #text()} is empty is a tombstone: it has been consumed or merged into a
 * neighbour and is dropped at the next compaction point. Tokens never outlive one
 * {@code normalize()} call.
 */
public final class Token {

    private final String originalText;
    private String text;
    private TokenType type;
    private final Set<Tag> tags;
    private String whitespaceAfter;
    private boolean converted;

    /**
     * Creates an unconverted token with no trailing whitespace.
     * @param text The token text.
     * @param type The lexical type.
     */
    public Token(String text, TokenType type) {
        this(text, text, type, "");
    }

    /**
     * Creates an unconverted token.
     * @param text The current text.
     * @param originalText The source slice the token was lexed from.
     * @param type The lexical type.
     * @param whitespaceAfter The verbatim whitespace that followed the token in the source.
     */
    public Token(String text, String originalText, TokenType type, String whitespaceAfter) {
        this.text = Objects.requireNonNull(text, "text");
        this.originalText = Objects.requireNonNull(originalText, "originalText");
        this.type = Objects.requireNonNull(type, "type");
        this.whitespaceAfter = whitespaceAfter == null ? "" : whitespaceAfter;
        this.tags = EnumSet.noneOf(Tag.class);
    }

    public String text() {
        return text;
    }

    public String originalText() {
        return originalText;
    }

    public TokenType type() {
        return type;
    }

    public Set<Tag> tags() {
        return tags;
    }

    public String whitespaceAfter() {
        return whitespaceAfter;
    }

    /**
     * @return {@code true} once the text has been semantically rewritten by a module.
     */
    public boolean isConverted() {
        return converted;
    }

    /**
     * Replaces the text without marking the token as converted (cosmetic clean-ups such as
     * character normalization).
     * @param newText The new text.
     */
    public void setText(String newText) {
        this.text = Objects.requireNonNull(newText, "newText");
    }

    /**
     * Replaces the text with its spoken form and marks the token as converted.
     * @param spoken The spoken replacement.
     */
    public void rewrite(String spoken) {
        this.text = Objects.requireNonNull(spoken, "spoken");
        this.converted = true;
    }

    /**
     * Replaces the text with its spoken form, marks the token as converted and retypes it.
     * @param spoken The spoken replacement.
     * @param newType The new lexical type.
     */
    public void rewrite(String spoken, TokenType newType) {
        rewrite(spoken);
        this.type = Objects.requireNonNull(newType, "newType");
    }

    public void setType(TokenType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public void setWhitespaceAfter(String whitespaceAfter) {
        this.whitespaceAfter = whitespaceAfter == null ? "" : whitespaceAfter;
    }

    public boolean hasTag(Tag tag) {
        return tags.contains(tag);
    }

    public void addTag(Tag tag) {
        tags.add(tag);
    }

    /**
     * @return {@code true} if the token has been consumed and waits for compaction.
     */
    public boolean isTombstone() {
        return text.isEmpty();
    }

    /**
     * Marks this token as consumed. Its trailing whitespace is discarded at compaction, so callers
     * that need it must fold it onto a surviving neighbour first (see {@link #absorb(Token)}).
     */
    public void tombstone() {
        this.text = "";
    }

    /**
     * Consumes another token into this one: the other token's trailing whitespace is appended to
     * this token's, and the other token becomes a tombstone.
     * @param consumed The token being merged into this one.
     */
    public void absorb(Token consumed) {
        this.whitespaceAfter = this.whitespaceAfter + consumed.whitespaceAfter;
        consumed.tombstone();
    }

    /**
     * @return A deep copy, used to roll back a failed module pass.
     */
    public Token copy() {
        Token copy = new Token(text, originalText, type, whitespaceAfter);
        copy.tags.addAll(tags);
        copy.converted = converted;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("%s(%s)%s", type, text, converted ? "*" : "");
    }
}
