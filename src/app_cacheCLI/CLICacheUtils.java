package app_cacheCLI;

public class CLICacheUtils {
  private static final String PROMPT = "Cache> ";

  protected static void printError(String error) {
    System.out.println(PROMPT + "Error! " + error);
  }

  protected static void printMessage(String message) {
    System.out.println(PROMPT + message);
  }

  public static String[] tokenize(String cmdLine) {
    if (cmdLine == null) {
      System.out.println();
      return new String[] {"quit"};
    }
    cmdLine = cmdLine.trim();
    return cmdLine.split("\\s+", -1);
  }

  protected static void printHelp() {
    StringBuilder sb = new StringBuilder();
    sb.append(PROMPT).append("TIERED CACHE HELP (Usage):\n");
    sb.append(PROMPT);
    sb.append("::::::::::::::::::::::::::::::::");
    sb.append("::::::::::::::::::::::::::::::::\n");
    sb.append(PROMPT).append("write <key> <value>");
    sb.append("\t writes a value through L1, cascading evictions downwards \n");
    sb.append(PROMPT).append("read <key>");
    sb.append("\t\t reads a value, promoting it to L1 if found in a lower level \n");
    sb.append(PROMPT).append("delete <key>");
    sb.append("\t\t removes the key from every level \n");
    sb.append(PROMPT).append("print");
    sb.append("\t\t\t prints the contents of every level \n");
    sb.append(PROMPT).append("dump");
    sb.append("\t\t\t prints the contents of every level as JSON \n");
    sb.append(PROMPT).append("stats");
    sb.append("\t\t\t prints level sizes and the number of dropped entries \n");
    sb.append(PROMPT).append("clear");
    sb.append("\t\t\t empties every level \n");

    sb.append(PROMPT).append("logLevel");
    sb.append("\t\t changes the logLevel \n");
    sb.append(PROMPT).append("\t\t\t ");
    sb.append("ALL | DEBUG | INFO | WARN | ERROR | FATAL | OFF \n");

    sb.append(PROMPT).append("quit ");
    sb.append("\t\t\t exits the program (can also press ctrl+d)");
    System.out.println(sb.toString());
  }

  protected static void printPossibleLogLevels() {
    System.out.println(PROMPT + "Possible log levels are:");
    System.out.println(PROMPT + "ALL | DEBUG | INFO | WARN | ERROR | FATAL | OFF");
  }

  public static void printPrompt() {
    System.out.print(PROMPT);
  }
}
