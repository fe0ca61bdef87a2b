package leap.truffle;

import leap.truffle.core.IrModel;
import leap.truffle.core.TimeIntegratorCode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * 从 JSON 加载时间积分器程序。
 *
 * 指令与表达式通过 {@code kind} 字段区分变体，未知字段被忽略。加载后立即校验。
 */
public final class Loader {
  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public TimeIntegratorCode load(File f) throws IOException {
    return TimeIntegratorCode.fromModule(mapper.readValue(f, IrModel.Module.class));
  }

  public TimeIntegratorCode load(String json) throws IOException {
    return TimeIntegratorCode.fromModule(mapper.readValue(json, IrModel.Module.class));
  }

  public TimeIntegratorCode load(InputStream in) throws IOException {
    return TimeIntegratorCode.fromModule(mapper.readValue(in, IrModel.Module.class));
  }

  public String toJson(IrModel.Module module) throws IOException {
    return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(module);
  }
}
