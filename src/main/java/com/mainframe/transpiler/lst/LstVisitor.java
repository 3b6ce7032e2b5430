package com.mainframe.transpiler.lst;

public interface LstVisitor<R> {
    R visitDivision(DivisionNode node);

    R visitSection(SectionNode node);

    R visitParagraph(ParagraphNode node);

    R visitSentence(SentenceNode node);

    R visitStatement(StatementNode node);

    R visitClause(ClauseNode node);

    R visitLiteral(LiteralNode node);

    R visitComment(CommentNode node);
}
