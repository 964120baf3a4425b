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

package seqsort.util.sort;

import java.util.HashMap;
import java.util.Map;
import seqsort.InvalidParameterException;


// Immutable set of options shared by all the sort methods.
// Only one pivot selector (strategy, index or position) can be active.
public final class SortConfig
{
   public static final SortConfig DEFAULT = new SortConfig(true, false, false, null, null, null, null);

   private final boolean ascending;
   private final boolean inPlace;
   private final boolean buildIndex;
   private final Integer gap;
   private final PivotStrategy pivotStrategy;
   private final Integer pivotIndex;
   private final Double pivotPosition;


   private SortConfig(boolean ascending, boolean inPlace, boolean buildIndex, Integer gap,
      PivotStrategy pivotStrategy, Integer pivotIndex, Double pivotPosition)
   {
      this.ascending = ascending;
      this.inPlace = inPlace;
      this.buildIndex = buildIndex;
      this.gap = gap;
      this.pivotStrategy = pivotStrategy;
      this.pivotIndex = pivotIndex;
      this.pivotPosition = pivotPosition;
   }


   // Recognized keys: ascending, descending, inPlace, buildIndex (Boolean),
   // gap (Integer), pivot (PivotStrategy or strategy name, Integer index or
   // Double position). Entries are consumed, leftover keys are an error.
   public static SortConfig fromMap(Map<String, Object> ctx)
   {
      SortConfig cfg = DEFAULT;

      if ((ctx == null) || (ctx.isEmpty()))
         return cfg;

      final Map<String, Object> map = new HashMap<>(ctx);
      Boolean bAscending = getBoolean(map, "ascending");
      Boolean bDescending = getBoolean(map, "descending");

      if ((bAscending != null) && (bDescending != null) && (bAscending.equals(bDescending)))
      {
         throw new InvalidParameterException("Conflicting direction options: ascending="+bAscending+
            ", descending="+bDescending);
      }

      if (bAscending != null)
         cfg = cfg.withAscending(bAscending);
      else if (bDescending != null)
         cfg = cfg.withAscending(!bDescending);

      Boolean bInPlace = getBoolean(map, "inPlace");

      if (bInPlace != null)
         cfg = cfg.withInPlace(bInPlace);

      Boolean bIndex = getBoolean(map, "buildIndex");

      if (bIndex != null)
         cfg = cfg.withIndex(bIndex);

      Object oGap = map.remove("gap");

      if (oGap != null)
      {
         if ((oGap instanceof Integer) == false)
            throw new InvalidParameterException("Invalid gap option: "+oGap+" (expected an integer)");

         cfg = cfg.withGap((Integer) oGap);
      }

      Object oPivot = map.remove("pivot");

      if (oPivot instanceof PivotStrategy)
         cfg = cfg.withPivot((PivotStrategy) oPivot);
      else if (oPivot instanceof String)
         cfg = cfg.withPivot(PivotStrategy.fromName((String) oPivot));
      else if (oPivot instanceof Integer)
         cfg = cfg.withPivotIndex((Integer) oPivot);
      else if (oPivot instanceof Double)
         cfg = cfg.withPivotPosition((Double) oPivot);
      else if (oPivot != null)
         throw new InvalidParameterException("Invalid pivot option: "+oPivot);

      if (map.isEmpty() == false)
         throw new InvalidParameterException("Unknown sort option(s): "+map.keySet());

      return cfg;
   }


   private static Boolean getBoolean(Map<String, Object> map, String key)
   {
      final Object val = map.remove(key);

      if ((val == null) || (val instanceof Boolean))
         return (Boolean) val;

      throw new InvalidParameterException("Invalid "+key+" option: "+val+" (expected a boolean)");
   }


   public SortConfig withAscending(boolean ascending)
   {
      return new SortConfig(ascending, this.inPlace, this.buildIndex, this.gap,
         this.pivotStrategy, this.pivotIndex, this.pivotPosition);
   }


   public SortConfig withInPlace(boolean inPlace)
   {
      return new SortConfig(this.ascending, inPlace, this.buildIndex, this.gap,
         this.pivotStrategy, this.pivotIndex, this.pivotPosition);
   }


   public SortConfig withIndex(boolean buildIndex)
   {
      return new SortConfig(this.ascending, this.inPlace, buildIndex, this.gap,
         this.pivotStrategy, this.pivotIndex, this.pivotPosition);
   }


   public SortConfig withGap(int gap)
   {
      if (gap < 1)
         throw new InvalidParameterException("Invalid shell sort gap: "+gap+" (must be at least 1)");

      return new SortConfig(this.ascending, this.inPlace, this.buildIndex, gap,
         this.pivotStrategy, this.pivotIndex, this.pivotPosition);
   }


   public SortConfig withPivot(PivotStrategy strategy)
   {
      if ((strategy == null) || (strategy == PivotStrategy.POSITION))
         throw new InvalidParameterException("Invalid pivot strategy: "+strategy);

      return new SortConfig(this.ascending, this.inPlace, this.buildIndex, this.gap,
         strategy, null, null);
   }


   public SortConfig withPivotIndex(int index)
   {
      if (index < 0)
         throw new InvalidParameterException("Invalid pivot index: "+index+" (must be at least 0)");

      return new SortConfig(this.ascending, this.inPlace, this.buildIndex, this.gap,
         null, index, null);
   }


   public SortConfig withPivotPosition(double position)
   {
      if ((position >= 0) == false || (position > 1))
         throw new InvalidParameterException("Invalid pivot position: "+position+" (must be in [0..1])");

      return new SortConfig(this.ascending, this.inPlace, this.buildIndex, this.gap,
         null, null, position);
   }


   public boolean isAscending()
   {
      return this.ascending;
   }


   public Direction getDirection()
   {
      return Direction.of(this.ascending);
   }


   public boolean isInPlace()
   {
      return this.inPlace;
   }


   public boolean isBuildIndex()
   {
      return this.buildIndex;
   }


   public Integer getGap()
   {
      return this.gap;
   }


   public PivotStrategy getPivotStrategy()
   {
      return this.pivotStrategy;
   }


   public Integer getPivotIndex()
   {
      return this.pivotIndex;
   }


   public Double getPivotPosition()
   {
      return this.pivotPosition;
   }


   @Override
   public String toString()
   {
      final StringBuilder sb = new StringBuilder(100);
      sb.append("{ascending=").append(this.ascending);
      sb.append(", inPlace=").append(this.inPlace);
      sb.append(", buildIndex=").append(this.buildIndex);

      if (this.gap != null)
         sb.append(", gap=").append(this.gap);

      if (this.pivotStrategy != null)
         sb.append(", pivot=").append(this.pivotStrategy);
      else if (this.pivotIndex != null)
         sb.append(", pivotIndex=").append(this.pivotIndex);
      else if (this.pivotPosition != null)
         sb.append(", pivotPosition=").append(this.pivotPosition);

      return sb.append('}').toString();
   }
}
