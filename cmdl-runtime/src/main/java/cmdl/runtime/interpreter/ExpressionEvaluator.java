package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlBoolean;
import cmdl.runtime.CmdlException;
import cmdl.runtime.CmdlNumber;
import cmdl.runtime.CmdlText;
import cmdl.runtime.CmdlValue;
import cmdl.runtime.interpreter.cache.BoundedCache;
import cmdl.runtime.interpreter.cache.CacheStats;
import cmdl.runtime.interpreter.cache.CaffeineCache;
import com.cmdlang.compiler.expr.BinaryExpr;
import com.cmdlang.compiler.expr.ExprParseException;
import com.cmdlang.compiler.expr.ExprParser;
import com.cmdlang.compiler.expr.ExprVisitor;
import com.cmdlang.compiler.expr.Expression;
import com.cmdlang.compiler.expr.ExpressionContext;
import com.cmdlang.compiler.expr.Identifier;
import com.cmdlang.compiler.expr.Literal;
import com.cmdlang.compiler.expr.UnaryExpr;

/**
 * 表达式求值器
 *
 * <p>表达式文本先解析为树（按 (上下文, 文本) 缓存），再对当前变量表求值。
 * 标识符替换为变量当前值，未定义为 0；算术上下文中内容为数字的文本按数字处理，
 * 条件上下文中文本保持为文本。</p>
 *
 * <p>任何失败都以 {@link ExpressionException} 抛出，携带原始表达式文本和原因。</p>
 */
public final class ExpressionEvaluator {

    private final BoundedCache<String, Expression> parsed;

    public ExpressionEvaluator(int cacheSize) {
        this.parsed = new CaffeineCache<>(cacheSize);
    }

    /**
     * 对变量表求值表达式
     *
     * @throws ExpressionException 解析失败或求值失败
     */
    public CmdlValue evaluate(String text, ExpressionContext context, VariableStore variables) {
        Expression tree = parse(text, context);
        try {
            return tree.accept(new Evaluation(context, variables));
        } catch (CmdlRuntimeException e) {
            throw e;
        } catch (CmdlException | ArithmeticException e) {
            throw new ExpressionException(text, e);
        }
    }

    /** 条件求值的便捷方法 */
    public boolean test(String condition, VariableStore variables) {
        return evaluate(condition, ExpressionContext.CONDITION, variables).isTruthy();
    }

    public CacheStats getCacheStats() {
        return parsed.getStats();
    }

    private Expression parse(String text, ExpressionContext context) {
        try {
            return parsed.computeIfAbsent(context.name() + ':' + text,
                    key -> ExprParser.parse(text, context));
        } catch (ExprParseException e) {
            throw new ExpressionException(text, e);
        }
    }

    /** 单次求值，持有上下文和变量表 */
    private static final class Evaluation implements ExprVisitor<CmdlValue> {

        private final ExpressionContext context;
        private final VariableStore variables;

        Evaluation(ExpressionContext context, VariableStore variables) {
            this.context = context;
            this.variables = variables;
        }

        @Override
        public CmdlValue visitLiteral(Literal node) {
            Object value = node.getValue();
            if (value instanceof Long) {
                return CmdlNumber.of((Long) value);
            }
            if (value instanceof Double) {
                return CmdlNumber.of((Double) value);
            }
            return CmdlText.of((String) value);
        }

        @Override
        public CmdlValue visitIdentifier(Identifier node) {
            CmdlValue value = variables.resolveForExpression(node.getName());
            if (context == ExpressionContext.ARITHMETIC && value.isText()
                    && Numerals.isNumber(((CmdlText) value).getValue())) {
                return Numerals.parse(((CmdlText) value).getValue());
            }
            return value;
        }

        @Override
        public CmdlValue visitUnary(UnaryExpr node) {
            CmdlValue operand = node.getOperand().accept(this);
            switch (node.getOperator()) {
                case NEG: return BinaryOps.negate(operand);
                case POS: return BinaryOps.plus(operand);
                case NOT: return CmdlBoolean.of(!operand.isTruthy());
                default:
                    throw new IllegalStateException("Unknown unary operator: " + node.getOperator());
            }
        }

        @Override
        public CmdlValue visitBinary(BinaryExpr node) {
            BinaryExpr.BinaryOp op = node.getOperator();
            CmdlValue left = node.getLeft().accept(this);

            // 短路：返回决定结果的那一侧
            if (op == BinaryExpr.BinaryOp.AND) {
                return left.isTruthy() ? node.getRight().accept(this) : left;
            }
            if (op == BinaryExpr.BinaryOp.OR) {
                return left.isTruthy() ? left : node.getRight().accept(this);
            }

            CmdlValue right = node.getRight().accept(this);
            switch (op) {
                case ADD: return BinaryOps.add(left, right);
                case SUB: return BinaryOps.sub(left, right);
                case MUL: return BinaryOps.mul(left, right);
                case DIV: return BinaryOps.div(left, right);
                case MOD: return BinaryOps.mod(left, right);
                case EQ:  return CmdlBoolean.of(BinaryOps.valuesEqual(left, right));
                case NE:  return CmdlBoolean.of(!BinaryOps.valuesEqual(left, right));
                case LT:
                case GT:
                case LE:
                case GE:
                    return BinaryOps.compare(op.getSymbol(), left, right);
                default:
                    throw new IllegalStateException("Unknown binary operator: " + op);
            }
        }
    }
}
