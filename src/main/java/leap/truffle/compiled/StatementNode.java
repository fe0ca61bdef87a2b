package leap.truffle.compiled;

import com.oracle.truffle.api.nodes.Node;

/**
 * 编译后端语句节点基类。
 */
public abstract class StatementNode extends Node {
  public abstract void execute(CompiledFrame frame);
}
