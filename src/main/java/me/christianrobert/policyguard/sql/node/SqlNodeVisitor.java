package me.christianrobert.policyguard.sql.node;

public interface SqlNodeVisitor<R> {

    // Statements
    R visitSelect(SelectQueryNode node);

    R visitInsert(InsertQueryNode node);

    R visitUpdate(UpdateQueryNode node);

    R visitDelete(DeleteQueryNode node);

    R visitRawStatement(RawStatementNode node);

    // Expressions and table sources
    R visitValue(ValueNode node);

    R visitColumn(ColumnNode node);

    R visitTable(TableNode node);

    R visitAlias(AliasNode node);

    R visitBinaryOperation(BinaryOperationNode node);

    R visitAnd(AndNode node);

    R visitOr(OrNode node);

    R visitNot(NotNode node);

    R visitFunction(FunctionNode node);

    R visitRaw(RawNode node);

    R visitValueList(ValueListNode node);

    R visitArray(ArrayNode node);

    R visitCast(CastNode node);

    R visitCase(CaseNode node);

    R visitSelectAll(SelectAllNode node);

    R visitValues(ValuesNode node);

    R visitLike(LikeNode node);

    R visitExists(ExistsNode node);
}
