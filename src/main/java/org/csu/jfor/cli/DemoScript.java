package org.csu.jfor.cli;

/**
 * 内置的演示程序，覆盖全部四种 for 形式。
 */
public final class DemoScript {

    public static final String SOURCE = """
            # Demo: both FOR styles

            print "Counter (ALGOL/BASIC style):"
            for i = 1 to 5 by 2 do
                print i
            end

            print "Iterator:"
            for w in ["Hello","Bonjour","Hola"] do
                print w + " World!"
            end

            print "Johnson/C-style semicolon loop:"
            for (j = 0; j < 5; j = j + 1) do
                print j
            end

            print "While-style using semicolons (omit init/step):"
            x = 3
            for (; x > 0; ) do
                print x
                x = x - 1
            end
            """;

    private DemoScript() {
    }
}
