package com.modgud.transform;

import com.modgud.ast.AstNode;
import com.modgud.ast.AstTransformer;
import com.modgud.ast.SourceLocation;
import com.modgud.ast.TreePrinter;
import com.modgud.ast.decl.FunctionDef;
import com.modgud.ast.decl.Program;
import com.modgud.ast.expr.Identifier;
import com.modgud.ast.stmt.Block;
import com.modgud.ast.stmt.ExpressionStmt;
import com.modgud.ast.stmt.ReturnStmt;
import com.modgud.ast.stmt.Statement;
import com.modgud.transform.cache.RewriteCache;
import com.modgud.transform.error.ExplicitReturnDisallowedException;
import com.modgud.transform.error.ImplicitReturnException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 函数级隐式返回改写。
 * <p>
 * 步骤：
 * <ol>
 *   <li>去掉函数上的所有修饰标记，避免物化时重复应用</li>
 *   <li>确认顶层函数体中没有显式 return</li>
 *   <li>改写函数体的尾位置，使其赋值给隐藏的结果变量</li>
 *   <li>在末尾追加唯一的 {@code return <结果变量>}</li>
 * </ol>
 * 函数体首句为字符串字面量时视为文档注释，保留在首位且不参与尾位置分析。
 */
public class FunctionRewriter {

    private static final Logger LOG = Logger.getLogger(FunctionRewriter.class.getName());

    private final RewriteOptions options;
    private final ExplicitReturnScanner scanner = new ExplicitReturnScanner();
    private final TailRewriter rewriter;
    private final RewriteCache cache;  // nullable

    public FunctionRewriter() {
        this(new RewriteOptions());
    }

    /**
     * 配置在构造时复制，之后对 options 的修改不影响本实例（缓存结果与配置始终一致）。
     */
    public FunctionRewriter(RewriteOptions options) {
        this.options = options.copy();
        this.rewriter = new TailRewriter(this.options);
        this.cache = this.options.getCacheSize() > 0 ? new RewriteCache(this.options.getCacheSize()) : null;
    }

    /** 返回生效配置的副本 */
    public RewriteOptions getOptions() {
        return options.copy();
    }

    /** 未启用缓存时返回 null */
    public RewriteCache getCache() {
        return cache;
    }

    /**
     * 在程序中定位名为 targetName 的函数定义并改写。
     * <p>
     * 从顶层开始查找，会进入复合语句和类体，但不进入其他函数体。
     * 有多个同名定义时全部改写，返回最后一个（后面的绑定覆盖前面的）。
     *
     * @throws IllegalArgumentException 找不到目标函数
     * @throws ImplicitReturnException  函数体无法改写
     */
    public RewrittenFunction rewriteFunction(Program program, String targetName) {
        TargetFunctionTransformer transformer = new TargetFunctionTransformer(targetName);
        Program rewrittenProgram = transformer.transform(program);
        if (transformer.last == null) {
            throw new IllegalArgumentException("Function '" + targetName + "' not found");
        }
        return transformer.last.withProgram(rewrittenProgram);
    }

    /**
     * 改写单个函数定义。
     *
     * @throws ImplicitReturnException 函数体无法改写
     */
    public RewrittenFunction rewriteFunction(FunctionDef function) {
        if (cache != null) {
            return cache.computeIfAbsent(function, this::doRewrite);
        }
        return doRewrite(function);
    }

    private RewrittenFunction doRewrite(FunctionDef function) {
        String name = function.getName();
        LOG.fine("改写函数: " + name);
        FunctionDef stripped = function.withoutAnnotations();
        Block body = stripped.getBody() != null ? stripped.getBody() : Block.empty();

        // 文档注释是元数据，不参与改写
        List<Statement> stmts = body.getStatements();
        Statement docstring = null;
        Block actualBody = body;
        if (!stmts.isEmpty() && stmts.get(0) instanceof ExpressionStmt
                && ((ExpressionStmt) stmts.get(0)).isStringLiteral()) {
            docstring = stmts.get(0);
            actualBody = new Block(body.getLocation(), stmts.subList(1, stmts.size()));
        }

        SourceLocation explicitReturn = scanner.scan(actualBody);
        if (explicitReturn != null) {
            LOG.fine("拒绝改写 " + name + ": 显式 return 位于 " + explicitReturn);
            throw new ExplicitReturnDisallowedException(
                    "Explicit return is disallowed in implicit-return function '" + name + "'", explicitReturn);
        }

        Block rewrittenBody;
        try {
            // 只有文档注释的函数体产生缺省值
            rewrittenBody = docstring != null && actualBody.isEmpty()
                    ? rewriter.absentBlock(docstring.getLocation())
                    : rewriter.rewriteBlock(actualBody);
        } catch (ImplicitReturnException e) {
            LOG.log(Level.FINE, "拒绝改写 " + name + ": " + e.getMessage(), e);
            throw e;
        }

        List<Statement> newStmts = new ArrayList<>(rewrittenBody.size() + 2);
        if (docstring != null) {
            newStmts.add(docstring);
        }
        newStmts.addAll(rewrittenBody.getStatements());
        SourceLocation location = stripped.getLocation();
        newStmts.add(new ReturnStmt(location, new Identifier(location, options.getResultSlot())));

        FunctionDef result = stripped.withBody(new Block(body.getLocation(), newStmts));
        String tag = RewrittenFunction.tagFor(name);
        if (options.isDumpRewrites()) {
            System.err.println("===== REWRITE DUMP " + tag + " =====");
            System.err.print(TreePrinter.print(result));
            System.err.println("===== END REWRITE DUMP =====");
        }
        return new RewrittenFunction(result, null, options.getResultSlot(), tag);
    }

    /**
     * 只改写目标函数定义，其余节点原样保留。
     */
    private final class TargetFunctionTransformer extends AstTransformer {
        private final String targetName;
        private RewrittenFunction last;

        TargetFunctionTransformer(String targetName) {
            this.targetName = targetName;
        }

        @Override
        public AstNode visitFunctionDef(FunctionDef node, Void ctx) {
            if (!node.getName().equals(targetName)) {
                return node;
            }
            last = rewriteFunction(node);
            return last.getFunction();
        }
    }
}
