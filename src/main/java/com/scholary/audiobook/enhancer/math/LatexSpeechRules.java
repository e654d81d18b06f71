package com.scholary.audiobook.enhancer.math;

import static com.scholary.audiobook.enhancer.math.SpeechRule.command;
import static com.scholary.audiobook.enhancer.math.SpeechRule.of;
import static com.scholary.audiobook.enhancer.math.SpeechRule.symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * The LaTeX-to-speech tables, built once and shared.
 *
 * <p>The primary table runs first, then the structural table cleans up whatever the primary
 * table left behind (nested fractions, multi-row matrices, unbraced scripts, spacing).
 *
 * <p>Ordering constraints of the primary table:
 *
 * <ol>
 *   <li>Probability and statistics notation before generic single-letter function application.
 *   <li>Calculus operators with bounds before their bare forms and before generic scripts.
 *   <li>Inner products, bras and kets before absolute values and plain angle brackets.
 *   <li>Combined subscript-superscript before the single subscript or superscript rules.
 *   <li>Greek letters, operators and symbols last: they are context-free substitutions.
 * </ol>
 *
 * <p>Braces are handled one level deep. A fraction inside a fraction is converted from the
 * innermost group outward and the structural table finishes the outer one.
 */
public final class LatexSpeechRules {

  /**
   * A script bound: braced group (group n), or a single letter, digit or command such as
   * {@code \infty} (group n+1).
   */
  private static final String BOUND = "(?:\\{([^{}]+)\\}|([A-Za-z0-9]|\\\\[A-Za-z]+))";

  private static final SpeechRuleTable PRIMARY = new SpeechRuleTable(primaryRules());

  private static final SpeechRuleTable STRUCTURAL = new SpeechRuleTable(structuralRules());

  private LatexSpeechRules() {}

  public static SpeechRuleTable primary() {
    return PRIMARY;
  }

  public static SpeechRuleTable structural() {
    return STRUCTURAL;
  }

  private static List<SpeechRule> primaryRules() {
    List<SpeechRule> rules = new ArrayList<>();

    // \text{Var}(X) as produced by the auto wrapper
    rules.add(of("\\\\(?:text|operatorname|mathrm)\\{(P|E|Var|SD|Cov|Corr)\\}(?=[(\\[])", "$1"));

    // Probability and statistics
    rules.add(of("\\bP\\(([^)]+)\\)", " probability of $1 "));
    rules.add(of("\\bE\\[([^\\]]+)\\]", " expected value of $1 "));
    rules.add(of("\\bVar\\(([^)]+)\\)", " variance of $1 "));
    rules.add(of("\\bSD\\(([^)]+)\\)", " standard deviation of $1 "));
    rules.add(of("\\bCov\\(([^,)]+),\\s*([^)]+)\\)", " covariance of $1 and $2 "));
    rules.add(of("\\bCorr\\(([^,)]+),\\s*([^)]+)\\)", " correlation of $1 and $2 "));

    // Generic function application: f(x), g(t)
    rules.add(of("\\b([a-zA-Z])\\(([^()]+)\\)", " $1 of $2 "));

    // Derivatives before plain fractions
    rules.add(of("\\\\frac\\{d\\}\\{d([^{}]+)\\}", " the derivative with respect to $1 of "));
    rules.add(
        of(
            "\\\\frac\\{\\\\partial\\}\\{\\\\partial\\s*([^{}]+)\\}",
            " the partial derivative with respect to $1 of "));
    rules.add(of("\\\\frac\\{([^{}]+)\\}\\{([^{}]+)\\}", " $1 over $2 "));

    // Roots
    rules.add(of("\\\\sqrt\\[([^\\]]+)\\]\\{([^{}]+)\\}", " the $1-th root of $2 "));
    rules.add(of("\\\\sqrt\\{([^{}]+)\\}", " the square root of $1 "));

    // Sums, integrals, products, limits
    rules.add(bounded("sum", "the sum"));
    rules.add(boundedBelow("sum", "the sum"));
    rules.add(command("sum", " the sum of "));
    rules.add(bounded("int", "the integral"));
    rules.add(command("int", " the integral of "));
    rules.add(command("oint", " the contour integral of "));
    rules.add(bounded("prod", "the product"));
    rules.add(boundedBelow("prod", "the product"));
    rules.add(command("prod", " the product of "));
    rules.add(
        of("\\\\lim_\\{([^{}]+?)\\s*\\\\to\\s*([^{}]+)\\}", " the limit as $1 approaches $2 of "));
    rules.add(of("\\\\lim_\\{([^{}]+)\\}", " the limit as $1 of "));
    rules.add(command("lim", " the limit of "));

    // Partial derivatives and del
    rules.add(of("\\\\partial\\^\\{([^{}]+)\\}", " partial to the power of $1 "));
    rules.add(command("partial", " partial "));
    rules.add(of("\\\\nabla\\^\\{([^{}]+)\\}", " del operator to the power of $1 "));
    rules.add(command("nabla", " del operator "));

    // Inner products, bras and kets
    rules.add(
        of(
            "\\\\langle\\s*([^|]+?)\\s*\\|\\s*([^|]+?)\\s*\\\\rangle",
            " the inner product of $1 and $2 "));
    rules.add(of("\\\\braket\\{([^{}]+)\\}\\{([^{}]+)\\}", " the inner product of $1 and $2 "));
    rules.add(of("\\|\\s*([^|]+?)\\s*\\\\rangle", " ket $1 "));
    rules.add(of("\\\\langle\\s*([^|]+?)\\s*\\|", " bra $1 "));
    rules.add(of("\\\\bra\\{([^{}]+)\\}", " bra $1 "));
    rules.add(of("\\\\ket\\{([^{}]+)\\}", " ket $1 "));

    // Combined scripts before single scripts
    rules.add(
        of("([a-zA-Z])_\\{([^{}]+)\\}\\^\\{([^{}]+)\\}", "$1 subscript $2 to the power of $3 "));
    rules.add(
        of("([a-zA-Z])\\^\\{([^{}]+)\\}_\\{([^{}]+)\\}", "$1 to the power of $2 subscript $3 "));
    rules.add(of("([a-zA-Z])\\^\\{([^{}]+)\\}", "$1 to the power of $2 "));
    rules.add(of("([a-zA-Z])_\\{([^{}]+)\\}", "$1 subscript $2 "));
    rules.add(of("\\^\\{([^{}]+)\\}", " to the power of $1 "));
    rules.add(of("_\\{([^{}]+)\\}", " subscript $1 "));

    // Vectors and accents
    rules.add(of("\\\\mathbf\\{([^{}]+)\\}", " bold $1 "));
    rules.add(of("\\\\vec\\{([^{}]+)\\}", " vector $1 "));
    rules.add(of("\\\\hat\\{([^{}]+)\\}", " $1 hat "));
    rules.add(of("\\\\bar\\{([^{}]+)\\}", " $1 bar "));
    rules.add(of("\\\\tilde\\{([^{}]+)\\}", " $1 tilde "));
    rules.add(of("\\\\ddot\\{([^{}]+)\\}", " $1 double dot "));
    rules.add(of("\\\\dot\\{([^{}]+)\\}", " $1 dot "));

    // Single-row matrices, then row and column separators
    rules.add(of("\\\\begin\\{[pb]matrix\\}([^\\\\]+)\\\\end\\{[pb]matrix\\}", " the matrix $1 "));
    rules.add(
        of("\\\\begin\\{vmatrix\\}([^\\\\]+)\\\\end\\{vmatrix\\}", " the determinant of $1 "));
    rules.add(of("\\\\\\\\", " and "));
    rules.add(of("&", " "));

    // Norms before absolute values
    rules.add(of("\\\\left\\|([^|]+?)\\\\right\\|", " the absolute value of $1 "));
    rules.add(of("\\|\\|([^|]+)\\|\\|", " the norm of $1 "));
    rules.add(of("\\\\\\|([^|]+?)\\\\\\|", " the norm of $1 "));
    rules.add(of("\\|([^|]+)\\|", " the absolute value of $1 "));

    addGreekLetters(rules);
    addOperators(rules);
    addSetTheory(rules);
    addFunctions(rules);
    addSymbolsAndDelimiters(rules);
    addArrows(rules);
    return rules;
  }

  private static void addGreekLetters(List<SpeechRule> rules) {
    String[] lower = {
      "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "iota", "kappa",
      "lambda", "mu", "nu", "xi", "pi", "rho", "sigma", "tau", "upsilon", "phi", "chi", "psi",
      "omega"
    };
    for (String letter : lower) {
      rules.add(command(letter, " " + letter + " "));
    }
    rules.add(command("varepsilon", " epsilon "));
    rules.add(command("vartheta", " theta "));
    rules.add(command("varpi", " pi "));
    rules.add(command("varrho", " rho "));
    rules.add(command("varsigma", " sigma "));
    rules.add(command("varphi", " phi "));

    String[] upper = {
      "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega"
    };
    for (String letter : upper) {
      rules.add(command(letter, " capital " + letter.toLowerCase() + " "));
    }
  }

  private static void addOperators(List<SpeechRule> rules) {
    rules.add(command("cdot", " times "));
    rules.add(command("times", " cross product "));
    rules.add(command("div", " divided by "));
    rules.add(command("pm", " plus or minus "));
    rules.add(command("mp", " minus or plus "));
    rules.add(command("leq", " is less than or equal to "));
    rules.add(command("le", " is less than or equal to "));
    rules.add(command("geq", " is greater than or equal to "));
    rules.add(command("ge", " is greater than or equal to "));
    rules.add(command("neq", " is not equal to "));
    rules.add(command("ne", " is not equal to "));
    rules.add(command("approx", " is approximately equal to "));
    rules.add(command("equiv", " is equivalent to "));
    rules.add(command("sim", " is similar to "));
    rules.add(command("propto", " is proportional to "));
    rules.add(command("to", " approaches "));
    rules.add(symbol("≤", " is less than or equal to "));
    rules.add(symbol("≥", " is greater than or equal to "));
    rules.add(symbol("≠", " is not equal to "));
    rules.add(symbol("=", " equals "));
  }

  private static void addSetTheory(List<SpeechRule> rules) {
    rules.add(command("in", " is an element of "));
    rules.add(command("notin", " is not an element of "));
    rules.add(command("subseteq", " is a subset of or equal to "));
    rules.add(command("subset", " is a subset of "));
    rules.add(command("supseteq", " is a superset of or equal to "));
    rules.add(command("supset", " is a superset of "));
    rules.add(command("cup", " union "));
    rules.add(command("cap", " intersection "));
    rules.add(symbol("∪", " union "));
    rules.add(symbol("∩", " intersection "));
    rules.add(command("emptyset", " the empty set "));
    rules.add(command("varnothing", " the empty set "));
    rules.add(command("forall", " for all "));
    rules.add(command("exists", " there exists "));
    rules.add(command("nexists", " there does not exist "));
  }

  private static void addFunctions(List<SpeechRule> rules) {
    rules.add(command("arcsin", " arcsine of "));
    rules.add(command("arccos", " arccosine of "));
    rules.add(command("arctan", " arctangent of "));
    rules.add(command("sinh", " hyperbolic sine of "));
    rules.add(command("cosh", " hyperbolic cosine of "));
    rules.add(command("tanh", " hyperbolic tangent of "));
    rules.add(command("sin", " sine of "));
    rules.add(command("cos", " cosine of "));
    rules.add(command("tan", " tangent of "));
    rules.add(command("sec", " secant of "));
    rules.add(command("csc", " cosecant of "));
    rules.add(command("cot", " cotangent of "));
    rules.add(command("ln", " natural log of "));
    rules.add(command("log", " log of "));
    rules.add(command("exp", " exponential of "));
  }

  private static void addSymbolsAndDelimiters(List<SpeechRule> rules) {
    rules.add(command("infty", " infinity "));
    rules.add(symbol("∞", " infinity "));
    rules.add(command("ldots", " dot dot dot "));
    rules.add(command("cdots", " dot dot dot "));
    rules.add(command("vdots", " vertical dots "));
    rules.add(command("ddots", " diagonal dots "));
    rules.add(command("hbar", " h-bar "));
    rules.add(command("ell", " script l "));

    rules.add(command("langle", " left angle bracket "));
    rules.add(command("rangle", " right angle bracket "));
    rules.add(command("lfloor", " floor of "));
    rules.add(command("rfloor", " "));
    rules.add(command("lceil", " ceiling of "));
    rules.add(command("rceil", " "));
    rules.add(of("\\\\left\\(", " "));
    rules.add(of("\\\\right\\)", " "));
    rules.add(of("\\\\left\\[", " open bracket "));
    rules.add(of("\\\\right\\]", " close bracket "));
    rules.add(of("\\\\left\\\\\\{", " open brace "));
    rules.add(of("\\\\right\\\\\\}", " close brace "));
  }

  private static void addArrows(List<SpeechRule> rules) {
    rules.add(command("rightarrow", " implies "));
    rules.add(command("leftarrow", " is implied by "));
    rules.add(command("leftrightarrow", " if and only if "));
    rules.add(command("Rightarrow", " implies "));
    rules.add(command("Leftarrow", " is implied by "));
    rules.add(command("Leftrightarrow", " if and only if "));
    rules.add(command("iff", " if and only if "));
    rules.add(command("uparrow", " up arrow "));
    rules.add(command("downarrow", " down arrow "));
    rules.add(command("mapsto", " maps to "));
  }

  private static List<SpeechRule> structuralRules() {
    List<SpeechRule> rules = new ArrayList<>();

    // Outer fraction left over after the inner one was converted
    rules.add(
        of(
            "\\\\frac\\{([^{}]+(?:\\{[^{}]*\\}[^{}]*)*)\\}\\{([^{}]+(?:\\{[^{}]*\\}[^{}]*)*)\\}",
            " the fraction $1 over $2 "));

    // Environments whose rows were flattened by the primary table
    rules.add(of("\\\\begin\\{[pb]matrix\\}([^\\\\]+)\\\\end\\{[pb]matrix\\}", " the matrix $1 "));
    rules.add(
        of("\\\\begin\\{vmatrix\\}([^\\\\]+)\\\\end\\{vmatrix\\}", " the determinant of $1 "));
    rules.add(of("\\\\begin\\{equation\\*?\\}([^\\\\]+)\\\\end\\{equation\\*?\\}", " the equation $1 "));
    rules.add(
        of(
            "\\\\begin\\{align\\*?\\}([^\\\\]+)\\\\end\\{align\\*?\\}",
            " the aligned equations $1 "));
    rules.add(
        of("\\\\begin\\{cases\\}([^\\\\]+)\\\\end\\{cases\\}", " the piecewise function $1 "));

    rules.add(of("\\\\binom\\{([^{}]+)\\}\\{([^{}]+)\\}", " $1 choose $2 "));

    rules.add(
        of("([a-zA-Z])\\^\\{([^{}]+)\\}_\\{([^{}]+)\\}", "$1 to the power of $2 subscript $3 "));
    rules.add(
        of("([a-zA-Z])_\\{([^{}]+)\\}\\^\\{([^{}]+)\\}", "$1 subscript $2 to the power of $3 "));
    rules.add(of("\\^\\{([^{}]+)\\}", " to the power of $1 "));
    rules.add(of("_\\{([^{}]+)\\}", " subscript $1 "));
    rules.add(of("\\^(\\w+)", " to the power of $1 "));
    rules.add(of("_(\\w+)", " subscript $1 "));

    rules.add(of("\\\\(?:operatorname|text|mathrm)\\{([^{}]+)\\}", " $1 "));
    rules.add(of("\\\\mathbb\\{([^{}]+)\\}", " the $1 numbers "));
    rules.add(of("\\\\mathcal\\{([^{}]+)\\}", " script $1 "));

    // Line breaks and spacing
    rules.add(of("\\\\\\\\", " and "));
    rules.add(command("qquad", " "));
    rules.add(command("quad", " "));
    rules.add(of("\\\\[,;:]", " "));
    rules.add(of("\\\\!", ""));
    return rules;
  }

  private static SpeechRule bounded(String name, String phrase) {
    return of("\\\\" + name + "_" + BOUND + "\\^" + BOUND, " " + phrase + " from $1$2 to $3$4 of ");
  }

  private static SpeechRule boundedBelow(String name, String phrase) {
    return of("\\\\" + name + "_" + BOUND + "(?!\\^)", " " + phrase + " over $1$2 of ");
  }
}
