package io.nightly.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import static java.util.Arrays.asList;

class TablePrinter
{
    private static final int MARGIN = 2;

    private final PrintStream out;
    private final List<List<String>> rows = new ArrayList<>();
    private final List<Integer> widths = new ArrayList<>();

    TablePrinter(PrintStream out)
    {
        this.out = out;
    }

    void row(String... row)
    {
        row(asList(row));
    }

    void row(Collection<String> row)
    {
        List<String> r = ImmutableList.copyOf(row);
        for (int i = 0; i < r.size(); i++) {
            int length = r.get(i).length();
            if (widths.size() <= i) {
                widths.add(length);
            }
            else {
                widths.set(i, Math.max(widths.get(i), length));
            }
        }
        rows.add(r);
    }

    void print()
    {
        for (List<String> row : rows) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < widths.size(); i++) {
                String value = row.size() > i ? row.get(i) : "";
                line.append(Strings.padEnd(value, widths.get(i) + MARGIN, ' '));
            }
            // no trailing blanks
            out.println(line.toString().replaceFirst("\\s+$", ""));
        }
    }
}
