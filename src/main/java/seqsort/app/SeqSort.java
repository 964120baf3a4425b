/*
Copyright 2026 The seqsort Authors
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package seqsort.app;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import seqsort.Error;
import seqsort.InvalidParameterException;
import seqsort.SortResult;
import seqsort.Sorting;
import seqsort.SortingException;
import seqsort.util.search.BinarySearch;
import seqsort.util.search.SequentialSearch;
import seqsort.util.sort.PivotStrategy;
import seqsort.util.sort.SortConfig;
import seqsort.util.sort.SortMethod;


// Command line front end: sorts the values provided on the command line,
// optionally searches one of them.
// EG. java -cp seqsort.jar seqsort.app.SeqSort --method=quick --descending --index 5 3 1 4 2
public class SeqSort implements Callable<Integer>
{
   private static final String[] CMD_LINE_ARGS = new String[]
   {
      "-m", "-g", "-p", "-s", "-v", "-h", "-x", "-b"
   };

   private static final int ARG_IDX_METHOD = 0;
   private static final int ARG_IDX_GAP = 1;
   private static final int ARG_IDX_PIVOT = 2;
   private static final int ARG_IDX_SEARCH = 3;
   private static final int ARG_IDX_VERBOSE = 4;

   private static final String DEFAULT_METHOD = "merge";
   private static final Integer[] DEMO_NUMBERS = { 54, 26, 93, 17, 77, 31, 44, 55, 20 };
   private static final String[] DEMO_STRINGS = { "d", "f", "a", "k", "b", "g", "z" };

   private final int verbosity;
   private final String method;
   private final boolean demo;
   private final boolean strings;
   private final boolean binary;
   private final String target;
   private final String[] values;
   private final Map<String, Object> options;
   private final PrintStream out;


   public SeqSort(Map<String, Object> map, PrintStream out)
   {
      final Map<String, Object> ctx = new HashMap<>(map);
      Integer iVerbose = (Integer) ctx.remove("verbose");
      this.verbosity = (iVerbose == null) ? 1 : iVerbose;
      String strMethod = (String) ctx.remove("method");
      this.method = (strMethod == null) ? DEFAULT_METHOD : strMethod;
      Boolean bDemo = (Boolean) ctx.remove("demo");
      this.demo = (bDemo == null) ? false : bDemo;
      Boolean bStrings = (Boolean) ctx.remove("strings");
      this.strings = (bStrings == null) ? false : bStrings;
      Boolean bBinary = (Boolean) ctx.remove("binary");
      this.binary = (bBinary == null) ? false : bBinary;
      this.target = (String) ctx.remove("search");
      String[] aValues = (String[]) ctx.remove("values");
      this.values = (aValues == null) ? new String[0] : aValues;
      this.options = ctx; // remaining entries are sort options
      this.out = (out == null) ? System.out : out;
   }


   public static void main(String[] args)
   {
      Map<String, Object> map = new HashMap<>();
      final int status = processCommandLine(args, map);

      if (status != 0)
         System.exit(status);

      if (map.containsKey("help"))
         System.exit(0);

      System.exit(new SeqSort(map, System.out).call());
   }


   // Return status (success = 0, error > 0)
   @Override
   public Integer call()
   {
      try
      {
         if (this.demo == true)
            return this.runDemo();

         if (this.values.length == 0)
         {
            System.err.println("No value to sort: try --help or -h");
            return Error.ERR_MISSING_PARAM;
         }

         final SortMethod sm = SortMethod.fromName(this.method);
         final SortConfig cfg = SortConfig.fromMap(this.options);
         printOut(this.out, "Method: " + sm.getName() + (sm.isStable() ? " (stable)" : ""), this.verbosity > 1);
         printOut(this.out, "Options: " + cfg, this.verbosity > 1);

         if (this.strings == false)
         {
            final Long[] longs = parseLongs(this.values);

            if (longs != null)
            {
               final Long key = (this.target == null) ? null : parseLongKey(this.target);
               return this.process(sm, cfg, longs, key);
            }

            final Double[] doubles = parseDoubles(this.values);

            if (doubles != null)
            {
               final Double key = (this.target == null) ? null : parseDoubleKey(this.target);
               return this.process(sm, cfg, doubles, key);
            }

            printOut(this.out, "Non numeric values, sorting as strings", this.verbosity > 1);
         }

         return this.process(sm, cfg, this.values.clone(), this.target);
      }
      catch (SortingException e)
      {
         System.err.println(e.getMessage());
         return e.getErrorCode();
      }
   }


   // 'key' is the search target parsed like the values, null if no search
   private <T extends Comparable<? super T>> int process(SortMethod sm, SortConfig cfg, T[] data, T key)
   {
      final long before = System.nanoTime();
      final SortResult<T> res = Sorting.sort(sm, data, cfg);
      final long after = System.nanoTime();
      printOut(this.out, "sorted = " + Arrays.toString(res.getData()), this.verbosity > 0);

      if (res.hasIndex())
         printOut(this.out, "index = " + Arrays.toString(res.getIndex()), this.verbosity > 0);

      printOut(this.out, "Sorting time: " + ((after-before) / 1000) + " us", this.verbosity > 2);

      if (key == null)
         return 0;

      final int idx;

      if (this.binary == true)
      {
         idx = BinarySearch.search(res.getData(), key, cfg.getDirection().<T>ordering());
      }
      else
      {
         idx = SequentialSearch.search(data, key);
      }

      // In place, the sequential search also runs on the sorted data
      final String where = ((this.binary == true) || (cfg.isInPlace() == true)) ? " in the sorted data" : "";

      if (idx == Sorting.NOT_FOUND)
         printOut(this.out, this.target + " not found" + where, this.verbosity > 0);
      else
         printOut(this.out, this.target + " found at index " + idx + where, this.verbosity > 0);

      return 0;
   }


   // Null if one value is not an integer
   private static Long[] parseLongs(String[] values)
   {
      final Long[] res = new Long[values.length];

      try
      {
         for (int i=0; i<res.length; i++)
            res[i] = Long.valueOf(values[i]);
      }
      catch (NumberFormatException e)
      {
         return null;
      }

      return res;
   }


   // Null if one value is not a number
   private static Double[] parseDoubles(String[] values)
   {
      final Double[] res = new Double[values.length];

      try
      {
         for (int i=0; i<res.length; i++)
            res[i] = Double.valueOf(values[i]);
      }
      catch (NumberFormatException e)
      {
         return null;
      }

      return res;
   }


   private static Long parseLongKey(String value)
   {
      try
      {
         return Long.valueOf(value);
      }
      catch (NumberFormatException e)
      {
         throw new InvalidParameterException("Invalid search value: " + value, e);
      }
   }


   private static Double parseDoubleKey(String value)
   {
      try
      {
         return Double.valueOf(value);
      }
      catch (NumberFormatException e)
      {
         throw new InvalidParameterException("Invalid search value: " + value, e);
      }
   }


   // Replay of the reference examples
   private int runDemo()
   {
      printOut(this.out, "==== Sort lists using the main function", true);
      printOut(this.out, "data = " + Arrays.toString(DEMO_NUMBERS), true);
      final SortConfig cfg = SortConfig.DEFAULT.withIndex(true);

      for (SortMethod sm : SortMethod.values())
      {
         SortConfig smCfg = cfg;

         if (sm == SortMethod.SHELL)
            smCfg = cfg.withGap(3);
         else if (sm == SortMethod.QUICK)
            smCfg = cfg.withPivotIndex(0);

         printOut(this.out, "\n" + sm.getName() + " sort " + smCfg + ":", true);
         printOut(this.out, Sorting.sort(sm, DEMO_NUMBERS, smCfg).toString(), true);
      }

      printOut(this.out, "\nDescending order (merge sort):", true);
      printOut(this.out, Sorting.sort(SortMethod.MERGE, DEMO_NUMBERS, cfg.withAscending(false)).toString(), true);
      printOut(this.out, "\nStrings (heap sort):", true);
      printOut(this.out, Sorting.sort(SortMethod.HEAP, DEMO_STRINGS, cfg).toString(), true);
      printOut(this.out, "\n==== Searches", true);
      final Integer[] sorted = Sorting.mergeSort(DEMO_NUMBERS).getData();
      printOut(this.out, "binary search 55 in " + Arrays.toString(sorted) + ": " + Sorting.binarySearch(sorted, 55), true);
      printOut(this.out, "binary search 56 in " + Arrays.toString(sorted) + ": " + Sorting.binarySearch(sorted, 56), true);
      printOut(this.out, "sequential search 77 in " + Arrays.toString(DEMO_NUMBERS) + ": " + Sorting.sequentialSearch(DEMO_NUMBERS, 77), true);
      return 0;
   }


   // Return 0 or an error code. Values are collected under 'values', sort
   // options under their SortConfig key.
   public static int processCommandLine(String args[], Map<String, Object> map)
   {
      int verbose = 1;
      int ctx = -1;
      List<String> values = new ArrayList<>();

      for (String arg : args)
      {
         arg = arg.trim();

         if (arg.equals("--help") || arg.equals("-h"))
         {
            printHelp();
            map.put("help", Boolean.TRUE);
            return 0;
         }

         if (ctx == -1)
         {
            int idx = -1;

            for (int i=0; i<CMD_LINE_ARGS.length; i++)
            {
               if (CMD_LINE_ARGS[i].equals(arg))
               {
                  idx = i;
                  break;
               }
            }

            if ((idx != -1) && (idx <= ARG_IDX_VERBOSE))
            {
               ctx = idx;
               continue;
            }
         }

         if (arg.equals("--descending"))
         {
            map.put("ascending", Boolean.FALSE);
            continue;
         }

         if (arg.equals("--in-place"))
         {
            map.put("inPlace", Boolean.TRUE);
            continue;
         }

         if (arg.equals("--index") || arg.equals("-x"))
         {
            map.put("buildIndex", Boolean.TRUE);
            continue;
         }

         if (arg.equals("--binary") || arg.equals("-b"))
         {
            map.put("binary", Boolean.TRUE);
            continue;
         }

         if (arg.equals("--strings"))
         {
            map.put("strings", Boolean.TRUE);
            continue;
         }

         if (arg.equals("--demo"))
         {
            map.put("demo", Boolean.TRUE);
            continue;
         }

         if (arg.startsWith("--method=") || (ctx == ARG_IDX_METHOD))
         {
            map.put("method", arg.startsWith("--method=") ? arg.substring(9).trim() : arg);
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--search=") || (ctx == ARG_IDX_SEARCH))
         {
            map.put("search", arg.startsWith("--search=") ? arg.substring(9).trim() : arg);
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--verbose=") || (ctx == ARG_IDX_VERBOSE))
         {
            String str = arg.startsWith("--verbose=") ? arg.substring(10).trim() : arg;

            try
            {
               verbose = Integer.parseInt(str);

               if ((verbose < 0) || (verbose > 3))
                  throw new NumberFormatException();
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid verbosity level provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--gap=") || (ctx == ARG_IDX_GAP))
         {
            String str = arg.startsWith("--gap=") ? arg.substring(6).trim() : arg;

            try
            {
               map.put("gap", Integer.parseInt(str));
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid gap provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--pivot=") || (ctx == ARG_IDX_PIVOT))
         {
            String str = arg.startsWith("--pivot=") ? arg.substring(8).trim() : arg;

            try
            {
               map.put("pivot", parsePivot(str));
            }
            catch (IllegalArgumentException e)
            {
               System.err.println("Invalid pivot provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--"))
         {
            System.err.println("Unknown option: "+arg);
            return Error.ERR_INVALID_PARAM;
         }

         values.add(arg);
      }

      if (ctx != -1)
         printOut(System.out, "Warning: ignoring option [" + CMD_LINE_ARGS[ctx] + "] with no value.", verbose>0);

      map.put("verbose", verbose);
      map.put("values", values.toArray(new String[values.size()]));
      return 0;
   }


   // first|last|middle|median3, index:<n> or a position in [0..1]
   static Object parsePivot(String str)
   {
      if (str.startsWith("index:"))
         return Integer.valueOf(str.substring(6).trim());

      if ((str.length() > 0) && (Character.isDigit(str.charAt(0)) || (str.charAt(0) == '.')))
         return Double.valueOf(str);

      try
      {
         return PivotStrategy.fromName(str);
      }
      catch (SortingException e)
      {
         throw new IllegalArgumentException(e.getMessage(), e);
      }
   }


   private static void printHelp()
   {
      printOut(System.out, "", true);
      printOut(System.out, "   -h, --help", true);
      printOut(System.out, "        display this message\n", true);
      printOut(System.out, "   -v, --verbose=<level>", true);
      printOut(System.out, "        set the verbosity level [0..3]", true);
      printOut(System.out, "        0=silent, 1=default, 2=display options, 3=display timings\n", true);
      printOut(System.out, "   -m, --method=<name>", true);
      printOut(System.out, "        bubble|short_bubble|selection|insertion|shell|quick|merge|heap", true);
      printOut(System.out, "        (default is merge)\n", true);
      printOut(System.out, "   --descending", true);
      printOut(System.out, "        sort in descending order\n", true);
      printOut(System.out, "   -x, --index", true);
      printOut(System.out, "        display the index array\n", true);
      printOut(System.out, "   -g, --gap=<gap>", true);
      printOut(System.out, "        initial gap of the shell sort\n", true);
      printOut(System.out, "   -p, --pivot=<pivot>", true);
      printOut(System.out, "        quick sort pivot: first|last|middle|median3, index:<n> or a position in [0..1]\n", true);
      printOut(System.out, "   -s, --search=<value>", true);
      printOut(System.out, "        search a value (sequential search unless --binary is provided)\n", true);
      printOut(System.out, "   -b, --binary", true);
      printOut(System.out, "        use a binary search\n", true);
      printOut(System.out, "   --strings", true);
      printOut(System.out, "        sort the values as strings (default: numbers when possible)\n", true);
      printOut(System.out, "   --demo", true);
      printOut(System.out, "        run the examples\n", true);
      printOut(System.out, "EG. java -cp seqsort.jar seqsort.app.SeqSort -m quick -p median3 --descending 5 3 1 4 2\n", true);
      printOut(System.out, "EG. java -cp seqsort.jar seqsort.app.SeqSort --method=shell --gap=3 --index --search=17 54 26 93 17 77\n", true);
   }


   private static void printOut(PrintStream ps, String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         ps.println(msg);
   }
}
