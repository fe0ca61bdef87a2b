package leap.truffle.nodes;

import leap.truffle.runtime.LeapFunction;
import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 外部函数调用节点
 *
 * 位置参数与关键字参数按函数描述的参数名排列后传给实现。
 */
public final class CallNode extends LeapExpressionNode {
  private static final Logger logger = Logger.getLogger(CallNode.class.getName());

  private final String functionId;
  @Children private final LeapExpressionNode[] positional;
  private final String[] keywordNames;
  @Children private final LeapExpressionNode[] keyword;

  public CallNode(String functionId, LeapExpressionNode[] positional,
      String[] keywordNames, LeapExpressionNode[] keyword) {
    this.functionId = functionId;
    this.positional = positional;
    this.keywordNames = keywordNames;
    this.keyword = keyword;
  }

  @Override
  @ExplodeLoop
  public Object executeGeneric(EvalScope scope) {
    Profiler.inc("call");
    Object[] posValues = new Object[positional.length];
    for (int i = 0; i < positional.length; i++) {
      posValues[i] = positional[i].executeGeneric(scope);
    }
    Object[] kwValues = new Object[keyword.length];
    for (int i = 0; i < keyword.length; i++) {
      kwValues[i] = keyword[i].executeGeneric(scope);
    }
    return invoke(scope.functions().get(functionId), posValues, kwValues);
  }

  @TruffleBoundary
  private Object invoke(LeapFunction fn, Object[] posValues, Object[] kwValues) {
    Map<String, Object> kw = new LinkedHashMap<>();
    for (int i = 0; i < keywordNames.length; i++) {
      kw.put(keywordNames[i], kwValues[i]);
    }
    List<Object> args = fn.resolveArgs(Arrays.asList(posValues), kw);
    logger.fine(() -> "call " + functionId + " args=" + args.size());
    return fn.call(args.toArray());
  }
}
