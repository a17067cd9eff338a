package com.natded.error;

/**
 * A cited line or block cannot be reached from the current scope, or a block
 * sits at a level the rule does not accept.
 *
 * Exactly one of {@link #line()} / {@link #blockId()} is set; the other is -1.
 */
public class ScopeException extends ProofException {

    private final int line;
    private final int blockId;
    private final int citedLevel;
    private final int currentLevel;

    private ScopeException(int line, int blockId, int citedLevel, int currentLevel, String message) {
        super(ErrorKind.SCOPE_ERROR, message);
        this.line = line;
        this.blockId = blockId;
        this.citedLevel = citedLevel;
        this.currentLevel = currentLevel;
    }

    public static ScopeException forLine(int line, int lineLevel, int currentLevel) {
        return new ScopeException(line, -1, lineLevel, currentLevel,
            "line " + line + " at level " + lineLevel
                + " is not accessible from the current scope at level " + currentLevel);
    }

    public static ScopeException forBlock(int blockId, int blockLevel, int requiredLevel) {
        return new ScopeException(-1, blockId, blockLevel, requiredLevel,
            "block " + blockId + " at level " + blockLevel
                + " cannot be used here, a block at level " + requiredLevel
                + " opened from the current scope is required");
    }

    /** The block's last line belongs to a nested block, so it is not the block's conclusion. */
    public static ScopeException forConclusion(int blockId, int blockLevel, int line, int lineLevel) {
        return new ScopeException(line, blockId, lineLevel, blockLevel,
            "block " + blockId + " ends on line " + line + " at level " + lineLevel
                + ", which belongs to a nested block; block " + blockId
                + " must conclude at its own level " + blockLevel);
    }

    public int line() {
        return line;
    }

    public int blockId() {
        return blockId;
    }

    public int citedLevel() {
        return citedLevel;
    }

    /**
     * For line citations the current level; for block levels the level the rule
     * required; for block conclusions the block's own level.
     */
    public int currentLevel() {
        return currentLevel;
    }
}
