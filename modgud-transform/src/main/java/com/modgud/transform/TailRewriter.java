package com.modgud.transform;

import com.modgud.ast.AstVisitor;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.expr.Expression;
import com.modgud.ast.expr.Literal;
import com.modgud.ast.stmt.*;
import com.modgud.transform.error.MissingImplicitReturnException;
import com.modgud.transform.error.UnsupportedConstructException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 尾位置改写器。
 * <p>
 * 尾位置是代码块的最后一条语句，决定该块产生的值。改写后每条可达路径都以
 * 对结果变量的赋值结束（或以 raise 结束）。各类尾语句的规则：
 * <ul>
 *   <li>表达式语句 → 赋值给结果变量</li>
 *   <li>if → 两个分支分别改写；缺少 else 时按 {@link BranchPolicy} 拒绝或合成缺省值分支</li>
 *   <li>try → try 块、每个 catch、else 块分别改写；finally 不改写</li>
 *   <li>match → 每个 case 改写，没有 case 或空 case 报错</li>
 *   <li>with → 改写资源块内部，空块报错</li>
 *   <li>pass → 赋缺省值</li>
 *   <li>raise → 保持不变，异常传播不会到达结果赋值</li>
 *   <li>循环及其他语句 → UnsupportedConstructException</li>
 * </ul>
 * 改写只构造新节点，输入树保持不变。
 */
public class TailRewriter implements AstVisitor<List<Statement>, Void> {

    private final String resultSlot;
    private final BranchPolicy missingElsePolicy;
    private final BranchPolicy emptyBlockPolicy;

    public TailRewriter(String resultSlot, BranchPolicy missingElsePolicy, BranchPolicy emptyBlockPolicy) {
        this.resultSlot = resultSlot;
        this.missingElsePolicy = missingElsePolicy;
        this.emptyBlockPolicy = emptyBlockPolicy;
    }

    public TailRewriter(RewriteOptions options) {
        this(options.getResultSlot(), options.getMissingElsePolicy(), options.getEmptyBlockPolicy());
    }

    public String getResultSlot() {
        return resultSlot;
    }

    /**
     * 改写代码块：尾语句之前的语句原样保留，尾语句按规则替换。
     */
    public Block rewriteBlock(Block block) {
        if (block.isEmpty()) {
            if (emptyBlockPolicy == BranchPolicy.REJECT) {
                throw new MissingImplicitReturnException("Empty block where a value is required",
                        block.getLocation());
            }
            return absentBlock(block.getLocation());
        }
        List<Statement> stmts = block.getStatements();
        List<Statement> result = new ArrayList<>(stmts.subList(0, stmts.size() - 1));
        result.addAll(rewriteTailStatement(block.getLast()));
        return new Block(block.getLocation(), result);
    }

    /**
     * 改写单条尾语句，返回替换它的语句列表。
     */
    public List<Statement> rewriteTailStatement(Statement stmt) {
        List<Statement> rewritten = stmt.accept(this, null);
        if (rewritten == null) {
            throw new UnsupportedConstructException(
                    "Unsupported tail construct: " + stmt.getClass().getSimpleName(), stmt.getLocation());
        }
        return rewritten;
    }

    /**
     * 只包含一条缺省值赋值的代码块。
     */
    public Block absentBlock(SourceLocation location) {
        return new Block(location, Collections.singletonList(assignAbsent(location)));
    }

    // ==================== 辅助方法 ====================

    private AssignStmt assign(SourceLocation location, Expression value) {
        return new AssignStmt(location, resultSlot, value);
    }

    private AssignStmt assignAbsent(SourceLocation location) {
        return assign(location, Literal.absent(location));
    }

    // ==================== 尾语句规则 ====================

    @Override
    public List<Statement> visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return Collections.<Statement>singletonList(assign(node.getLocation(), node.getExpression()));
    }

    @Override
    public List<Statement> visitIfStmt(IfStmt node, Void ctx) {
        if (!node.hasElse() && missingElsePolicy == BranchPolicy.REJECT) {
            throw new MissingImplicitReturnException(
                    "If without else at tail position must have an else clause", node.getLocation());
        }
        Block thenBlock = rewriteBlock(node.getThenBlock());
        Block elseBlock = node.hasElse()
                ? rewriteBlock(node.getElseBlock())
                : absentBlock(node.getLocation());
        return Collections.<Statement>singletonList(
                new IfStmt(node.getLocation(), node.getCondition(), thenBlock, elseBlock));
    }

    @Override
    public List<Statement> visitTryStmt(TryStmt node, Void ctx) {
        Block tryBlock = rewriteBlock(node.getTryBlock());
        List<CatchClause> catches = new ArrayList<>(node.getCatchClauses().size());
        for (CatchClause clause : node.getCatchClauses()) {
            catches.add(clause.withBody(rewriteBlock(clause.getBody())));
        }
        // else 只在 try 块正常完成时执行，同样需要产生值
        Block elseBlock = node.hasElse() ? rewriteBlock(node.getElseBlock()) : node.getElseBlock();
        // finally 在结果确定之后执行，不能在这里设置结果
        return Collections.<Statement>singletonList(new TryStmt(node.getLocation(), tryBlock, catches,
                elseBlock, node.getFinallyBlock()));
    }

    @Override
    public List<Statement> visitMatchStmt(MatchStmt node, Void ctx) {
        if (node.getCases().isEmpty()) {
            throw new MissingImplicitReturnException("Match without cases cannot yield a value", node.getLocation());
        }
        List<MatchCase> cases = new ArrayList<>(node.getCases().size());
        for (MatchCase matchCase : node.getCases()) {
            if (matchCase.getBody() == null || matchCase.getBody().isEmpty()) {
                SourceLocation location = matchCase.getLocation().isKnown()
                        ? matchCase.getLocation() : node.getLocation();
                throw new MissingImplicitReturnException("Empty match case body cannot yield a value", location);
            }
            cases.add(matchCase.withBody(rewriteBlock(matchCase.getBody())));
        }
        return Collections.<Statement>singletonList(new MatchStmt(node.getLocation(), node.getSubject(), cases));
    }

    @Override
    public List<Statement> visitWithStmt(WithStmt node, Void ctx) {
        if (node.getBody() == null || node.getBody().isEmpty()) {
            throw new MissingImplicitReturnException("Empty with body cannot yield a value", node.getLocation());
        }
        return Collections.<Statement>singletonList(new WithStmt(node.getLocation(), node.getResources(),
                rewriteBlock(node.getBody()), node.isAsync()));
    }

    @Override
    public List<Statement> visitLoopStmt(LoopStmt node, Void ctx) {
        String kind = node.getKind() == LoopStmt.Kind.WHILE ? "While" : "For";
        throw new UnsupportedConstructException(kind + " loop cannot produce an implicit return value",
                node.getLocation());
    }

    @Override
    public List<Statement> visitPassStmt(PassStmt node, Void ctx) {
        return Collections.<Statement>singletonList(assignAbsent(node.getLocation()));
    }

    @Override
    public List<Statement> visitRaiseStmt(RaiseStmt node, Void ctx) {
        return Collections.<Statement>singletonList(node);
    }
}
