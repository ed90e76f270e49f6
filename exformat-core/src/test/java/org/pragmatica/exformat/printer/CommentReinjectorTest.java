package org.pragmatica.exformat.printer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.exformat.ledger.SourceLedger.sourceLedger;

class CommentReinjectorTest {

    @Test
    void reinject_appendsCommentToLineWithSameFingerprint() {
        var ledger = sourceLedger("foo(a,b) # keep\n");

        assertThat(CommentReinjector.reinject("foo(a, b)", ledger)).isEqualTo("foo(a, b) # keep\n");
    }

    @Test
    void reinject_handsOutDuplicatesInOrder() {
        var ledger = sourceLedger("x # one\nx # two\n");

        assertThat(CommentReinjector.reinject("x\nx\nx\n", ledger)).isEqualTo("x # one\nx # two\nx\n");
    }

    @Test
    void reinject_stripsTrailingWhitespace_andNormalizesFinalNewline() {
        var ledger = sourceLedger("");

        assertThat(CommentReinjector.reinject("a   \n\n  \nb\n\n\n", ledger)).isEqualTo("a\n\n\nb\n");
        assertThat(CommentReinjector.reinject("", ledger)).isEqualTo("\n");
    }

    @Test
    void reinject_leavesUnmatchedCommentsOut() {
        var ledger = sourceLedger("bar # lost\n");

        assertThat(CommentReinjector.reinject("foo", ledger)).isEqualTo("foo\n");
        assertThat(ledger.pendingInlineComments()).isEqualTo(1);
    }
}
